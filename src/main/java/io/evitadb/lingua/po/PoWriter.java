package io.evitadb.lingua.po;

import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.PoEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Serializes a {@link PoCatalog} back into gettext PO syntax.
 * Strings containing inner line breaks are split after each `\n` in the way gettext tools do,
 * starting with an empty `""` line.
 */
public final class PoWriter {

	private static final String OBSOLETE_PREFIX = "#~ ";

	/**
	 * Renders the whole catalog, entries separated by a blank line.
	 *
	 * @param catalog the catalog to render
	 * @return PO file content
	 */
	@Nonnull
	public String write(@Nonnull PoCatalog catalog) {
		Objects.requireNonNull(catalog, "catalog must not be null");

		final StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (final PoEntry entry : catalog.getEntries()) {
			if (!first) {
				sb.append('\n');
			}
			writeEntry(sb, entry, catalog.getPluralFormCount());
			first = false;
		}
		return sb.toString();
	}

	private static void writeEntry(@Nonnull StringBuilder sb, @Nonnull PoEntry entry, int pluralForms) {
		for (final String comment : entry.getComments()) {
			sb.append(comment).append('\n');
		}
		final String prefix = entry.isObsolete() ? OBSOLETE_PREFIX : "";

		writeField(sb, prefix, "msgctxt", entry.getMsgctxt());
		writeField(sb, prefix, "msgid", entry.getMsgid());
		writeField(sb, prefix, "msgid_plural", entry.getMsgidPlural());

		if (entry.isPlural()) {
			// every declared form is written, missing ones as empty strings
			final SortedSet<Integer> forms = new TreeSet<>(entry.getMsgstrPlural().keySet());
			for (int i = 0; i < pluralForms; i++) {
				forms.add(i);
			}
			for (final int form : forms) {
				writeField(sb, prefix, "msgstr[" + form + "]", entry.getTranslation(form));
			}
		} else {
			writeField(sb, prefix, "msgstr", entry.getMsgstr());
		}
	}

	private static void writeField(
		@Nonnull StringBuilder sb,
		@Nonnull String prefix,
		@Nonnull String keyword,
		@Nullable String value
	) {
		if (value == null) {
			return;
		}
		final int firstBreak = value.indexOf('\n');
		if (firstBreak < 0 || firstBreak == value.length() - 1) {
			sb.append(prefix).append(keyword).append(' ').append(quote(value)).append('\n');
			return;
		}

		sb.append(prefix).append(keyword).append(" \"\"\n");
		int start = 0;
		while (start < value.length()) {
			final int lineBreak = value.indexOf('\n', start);
			final int end = lineBreak < 0 ? value.length() : lineBreak + 1;
			sb.append(prefix).append(quote(value.substring(start, end))).append('\n');
			start = end;
		}
	}

	/**
	 * Escapes and quotes a string for PO output.
	 *
	 * @param value the raw string
	 * @return the quoted PO string literal
	 */
	@Nonnull
	static String quote(@Nonnull String value) {
		final StringBuilder sb = new StringBuilder(value.length() + 2);
		sb.append('"');
		for (int i = 0; i < value.length(); i++) {
			final char c = value.charAt(i);
			switch (c) {
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
