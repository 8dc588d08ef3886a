package io.evitadb.lingua.po;

import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.PoEntry;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses gettext PO files.
 *
 * Supported syntax:
 * ```
 * # translator comment
 * #. extracted comment
 * #: reference.c:42
 * #, fuzzy, c-format
 * msgctxt "context"
 * msgid "source"
 * msgid_plural "sources"
 * msgstr[0] "translation"
 * msgstr[1] ""
 *       "continued"
 * #~ msgid "obsolete"
 * #~ msgstr "entry"
 * ```
 */
public final class PoParser {

	private static final Pattern KEYWORD_PATTERN = Pattern.compile(
		"^(msgctxt|msgid_plural|msgid|msgstr)(?:\\[(\\d{1,2})])?\\s+(\".*)$"
	);
	private static final String OBSOLETE_PREFIX = "#~";

	/**
	 * Parses the textual content of a PO file.
	 *
	 * @param content the PO file content
	 * @return parsed catalog with entries in file order
	 * @throws PoParseException if the content is malformed
	 */
	@Nonnull
	public PoCatalog parse(@Nonnull String content) throws PoParseException {
		Objects.requireNonNull(content, "content must not be null");

		final List<PoEntry> entries = new ArrayList<>();
		final List<String> lines = content.lines().toList();
		EntryBuilder current = new EntryBuilder();

		for (int i = 0; i < lines.size(); i++) {
			final int lineNumber = i + 1;
			final String line = stripBom(lines.get(i), i).strip();

			if (line.isEmpty()) {
				current = finish(current, entries, lineNumber);
				continue;
			}

			boolean obsolete = false;
			String body = line;
			if (line.startsWith(OBSOLETE_PREFIX)) {
				final String rest = line.substring(OBSOLETE_PREFIX.length()).strip();
				if (!rest.startsWith("|") && !rest.isEmpty()) {
					obsolete = true;
					body = rest;
				}
			}

			if (!obsolete && body.startsWith("#")) {
				// a comment after keywords starts the next entry
				if (current.hasKeywords()) {
					current = finish(current, entries, lineNumber);
				}
				current.comments.add(body);
				continue;
			}

			if (body.startsWith("\"")) {
				current.appendContinuation(unquote(body, lineNumber), lineNumber);
				continue;
			}

			final Matcher matcher = KEYWORD_PATTERN.matcher(body);
			if (!matcher.matches()) {
				throw new PoParseException("Unexpected content: '" + truncate(body, 40) + "'", lineNumber);
			}

			final String keyword = matcher.group(1);
			// msgctxt or msgid after a complete message starts the next entry
			if (("msgctxt".equals(keyword) || "msgid".equals(keyword)) && current.hasMsgstr()) {
				current = finish(current, entries, lineNumber);
			}
			current.obsolete = current.obsolete || obsolete;
			current.setField(keyword, matcher.group(2), unquote(matcher.group(3), lineNumber), lineNumber);
		}

		finish(current, entries, lines.size());
		return new PoCatalog(entries);
	}

	@Nonnull
	private static EntryBuilder finish(
		@Nonnull EntryBuilder builder,
		@Nonnull List<PoEntry> entries,
		int lineNumber
	) throws PoParseException {
		if (builder.msgid != null) {
			entries.add(builder.build(lineNumber));
			return new EntryBuilder();
		}
		if (builder.hasKeywords()) {
			throw new PoParseException("Entry without msgid", lineNumber);
		}
		// comments not followed by any message are kept with the next entry
		return builder;
	}

	/**
	 * Extracts and unescapes the content of a quoted PO string.
	 *
	 * @param quoted     the quoted token, including the surrounding quotes
	 * @param lineNumber line number for error reporting
	 * @return the unescaped string
	 * @throws PoParseException if the token is not properly quoted
	 */
	@Nonnull
	static String unquote(@Nonnull String quoted, int lineNumber) throws PoParseException {
		final String token = quoted.strip();
		if (token.length() < 2 || !token.startsWith("\"") || !token.endsWith("\"")) {
			throw new PoParseException("Malformed string literal: '" + truncate(token, 40) + "'", lineNumber);
		}
		final String inner = token.substring(1, token.length() - 1);
		final StringBuilder sb = new StringBuilder(inner.length());
		for (int i = 0; i < inner.length(); i++) {
			final char c = inner.charAt(i);
			if (c != '\\') {
				sb.append(c);
				continue;
			}
			if (i + 1 >= inner.length()) {
				throw new PoParseException("Dangling escape character", lineNumber);
			}
			final char next = inner.charAt(++i);
			switch (next) {
				case 'n' -> sb.append('\n');
				case 't' -> sb.append('\t');
				case 'r' -> sb.append('\r');
				case '"' -> sb.append('"');
				case '\\' -> sb.append('\\');
				default -> sb.append('\\').append(next);
			}
		}
		return sb.toString();
	}

	@Nonnull
	private static String stripBom(@Nonnull String line, int index) {
		if (index == 0 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
			return line.substring(1);
		}
		return line;
	}

	@Nonnull
	private static String truncate(@Nonnull String text, int maxLength) {
		if (text.length() <= maxLength) {
			return text;
		}
		return text.substring(0, maxLength) + "...";
	}

	/**
	 * Mutable accumulator of one entry while its lines are being read.
	 */
	private static final class EntryBuilder {
		private final List<String> comments = new ArrayList<>();
		private final Map<Integer, String> msgstrPlural = new TreeMap<>();
		@Nullable private String msgctxt;
		@Nullable private String msgid;
		@Nullable private String msgidPlural;
		@Nullable private String msgstr;
		private boolean obsolete;
		@Nullable private String lastKeyword;
		@Nullable private Integer lastPluralIndex;

		boolean hasKeywords() {
			return this.lastKeyword != null;
		}

		boolean hasMsgstr() {
			return this.msgstr != null || !this.msgstrPlural.isEmpty();
		}

		void setField(
			@Nonnull String keyword,
			@Nullable String pluralIndex,
			@Nonnull String value,
			int lineNumber
		) throws PoParseException {
			if (pluralIndex != null && !"msgstr".equals(keyword)) {
				throw new PoParseException("Plural index is only allowed on msgstr", lineNumber);
			}
			this.lastKeyword = keyword;
			this.lastPluralIndex = null;
			switch (keyword) {
				case "msgctxt" -> this.msgctxt = value;
				case "msgid" -> this.msgid = value;
				case "msgid_plural" -> this.msgidPlural = value;
				case "msgstr" -> {
					if (pluralIndex != null) {
						this.lastPluralIndex = Integer.valueOf(pluralIndex);
						this.msgstrPlural.put(this.lastPluralIndex, value);
					} else {
						this.msgstr = value;
					}
				}
				default -> throw new PoParseException("Unknown keyword: " + keyword, lineNumber);
			}
		}

		void appendContinuation(@Nonnull String value, int lineNumber) throws PoParseException {
			if (this.lastKeyword == null) {
				throw new PoParseException("String continuation without keyword", lineNumber);
			}
			switch (this.lastKeyword) {
				case "msgctxt" -> this.msgctxt = this.msgctxt + value;
				case "msgid" -> this.msgid = this.msgid + value;
				case "msgid_plural" -> this.msgidPlural = this.msgidPlural + value;
				default -> {
					if (this.lastPluralIndex != null) {
						this.msgstrPlural.merge(this.lastPluralIndex, value, String::concat);
					} else {
						this.msgstr = this.msgstr + value;
					}
				}
			}
		}

		@Nonnull
		PoEntry build(int lineNumber) throws PoParseException {
			if (this.msgstr == null && this.msgstrPlural.isEmpty()) {
				throw new PoParseException("Entry '" + truncate(Objects.requireNonNull(this.msgid), 40) + "' has no msgstr", lineNumber);
			}
			return new PoEntry(
				this.comments,
				this.msgctxt,
				Objects.requireNonNull(this.msgid),
				this.msgidPlural,
				this.msgstr == null ? "" : this.msgstr,
				this.msgstrPlural,
				this.obsolete
			);
		}
	}
}
