package io.evitadb.lingua.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PoCatalog metadata and translation access")
class PoCatalogTest {

	private static PoEntry header(String msgstr) {
		return PoEntry.singular("", msgstr);
	}

	@Test
	@DisplayName("parses header metadata in order")
	void shouldParseHeaderMetadata() {
		final PoCatalog catalog = new PoCatalog(List.of(
			header("Project-Id-Version: demo 1.0\nLanguage: de_DE\nPlural-Forms: nplurals=3; plural=(n==1 ? 0 : 1);\n")
		));

		final Map<String, String> metadata = catalog.getMetadata();

		assertEquals(List.of("Project-Id-Version", "Language", "Plural-Forms"), List.copyOf(metadata.keySet()));
		assertEquals(Optional.of("de_DE"), catalog.getMetadata("Language"));
		assertEquals(3, catalog.getPluralFormCount());
	}

	@Test
	@DisplayName("defaults to two plural forms without header")
	void shouldDefaultToTwoPluralForms() {
		final PoCatalog catalog = new PoCatalog(List.of(PoEntry.singular("Hello", "")));

		assertTrue(catalog.getHeader().isEmpty());
		assertTrue(catalog.getMetadata().isEmpty());
		assertEquals(2, catalog.getPluralFormCount());
	}

	@Test
	@DisplayName("ignores plural form counts that are not plausible")
	void shouldIgnoreImplausiblePluralFormCount() {
		for (final String nplurals : List.of("99999999999", "40", "0")) {
			final PoCatalog catalog = new PoCatalog(List.of(
				header("Plural-Forms: nplurals=" + nplurals + "; plural=0;\n")
			));

			assertEquals(2, catalog.getPluralFormCount(), "nplurals=" + nplurals);
		}
		final PoCatalog arabic = new PoCatalog(List.of(header("Plural-Forms: nplurals=6; plural=(n%100>=11 ? 4 : 5);\n")));
		assertEquals(6, arabic.getPluralFormCount());
	}

	@Test
	@DisplayName("rewrites existing metadata value in place")
	void shouldRewriteMetadata() {
		final PoCatalog catalog = new PoCatalog(List.of(
			header("Language: en\nContent-Type: text/plain; charset=UTF-8\n"),
			PoEntry.singular("Hello", "")
		));

		catalog.setMetadata("Language", "fa");

		assertEquals(Optional.of("fa"), catalog.getMetadata("Language"));
		assertEquals(Optional.of("text/plain; charset=UTF-8"), catalog.getMetadata("Content-Type"));
		assertTrue(catalog.getHeader().orElseThrow().getMsgstr().startsWith("Language: fa\n"));
	}

	@Test
	@DisplayName("applies translations to singular and plural fields")
	void shouldApplyTranslations() {
		final PoCatalog catalog = new PoCatalog(List.of(
			header("Language: en\n"),
			PoEntry.singular("Hello", ""),
			PoEntry.plural("One file", "%d files", Map.of())
		));

		catalog.applyTranslation(EntryKey.primary(1), "Salam");
		catalog.applyTranslation(EntryKey.plural(2, 1), "%d parvande");

		assertEquals("Salam", catalog.getTranslation(EntryKey.primary(1)));
		assertEquals("%d parvande", catalog.getTranslation(EntryKey.plural(2, 1)));
		assertEquals("", catalog.getTranslation(EntryKey.plural(2, 0)));
		assertEquals(2, catalog.countTranslated());
	}

	@Test
	@DisplayName("copy is independent of the original")
	void shouldCopyDeeply() {
		final PoCatalog catalog = new PoCatalog(List.of(PoEntry.singular("Hello", "")));
		final PoCatalog copy = catalog.copy();

		catalog.applyTranslation(EntryKey.primary(0), "Hallo");

		assertEquals("", copy.getTranslation(EntryKey.primary(0)));
		assertNotEquals(catalog, copy);
	}
}
