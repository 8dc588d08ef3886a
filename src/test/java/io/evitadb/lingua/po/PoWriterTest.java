package io.evitadb.lingua.po;

import io.evitadb.lingua.model.EntryKey;
import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.PoEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoWriter renders gettext catalogs")
class PoWriterTest {

	private final PoWriter writer = new PoWriter();

	@Test
	@DisplayName("writes entries separated by blank lines")
	void shouldWriteEntries() {
		final PoCatalog catalog = new PoCatalog(List.of(
			new PoEntry(List.of("#, fuzzy"), null, "Hello", null, "Salam", Map.of(), false),
			PoEntry.singular("Bye", "")
		));

		final String expected = """
			#, fuzzy
			msgid "Hello"
			msgstr "Salam"

			msgid "Bye"
			msgstr ""
			""";
		assertEquals(expected, writer.write(catalog));
	}

	@Test
	@DisplayName("splits multi-line header after each line break")
	void shouldSplitMultiLineStrings() {
		final PoCatalog catalog = new PoCatalog(List.of(PoEntry.singular("", "Language: fa\nPlural-Forms: nplurals=1; plural=0;\n")));

		final String expected = """
			msgid ""
			msgstr ""
			"Language: fa\\n"
			"Plural-Forms: nplurals=1; plural=0;\\n"
			""";
		assertEquals(expected, writer.write(catalog));
	}

	@Test
	@DisplayName("writes every declared plural form")
	void shouldWriteAllPluralForms() {
		final PoCatalog catalog = new PoCatalog(List.of(PoEntry.plural("One file", "%d files", Map.of())));
		catalog.applyTranslation(EntryKey.plural(0, 1), "%d parvande");

		final String written = writer.write(catalog);

		assertTrue(written.contains("msgstr[0] \"\"\n"));
		assertTrue(written.contains("msgstr[1] \"%d parvande\"\n"));
	}

	@Test
	@DisplayName("prefixes obsolete entries")
	void shouldPrefixObsoleteEntries() {
		final PoCatalog catalog = new PoCatalog(List.of(new PoEntry(List.of(), null, "Old", null, "Alt", Map.of(), true)));

		assertEquals("#~ msgid \"Old\"\n#~ msgstr \"Alt\"\n", writer.write(catalog));
	}

	@Test
	@DisplayName("escapes special characters")
	void shouldEscape() {
		assertEquals("\"a\\\"b\\\\c\\td\"", PoWriter.quote("a\"b\\c\td"));
	}

	@Test
	@DisplayName("written catalog parses back to an equal catalog")
	void shouldParseWrittenCatalog() throws Exception {
		final PoCatalog catalog = new PoCatalog(List.of(
			PoEntry.singular("", "Language: de\nPlural-Forms: nplurals=2; plural=(n != 1);\n"),
			new PoEntry(List.of("#: app.c:3"), "menu", "Open\nfile", null, "Datei\noffnen", Map.of(), false),
			PoEntry.plural("One item", "%d items", Map.of(0, "Ein Element", 1, "%d Elemente"))
		));

		assertEquals(catalog, new PoParser().parse(writer.write(catalog)));
	}
}
