package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Single message of a PO catalog. Source texts (`msgctxt`, `msgid`, `msgid_plural`) are fixed
 * at construction; translations (`msgstr`, `msgstr[n]`) are mutable and written back by the
 * translation pipeline.
 *
 * Comment lines are kept verbatim (including their `#` markers) so that writing the entry back
 * reproduces them in the original order.
 */
public final class PoEntry {

	@Nonnull
	private final List<String> comments;
	@Nullable
	private final String msgctxt;
	@Nonnull
	private final String msgid;
	@Nullable
	private final String msgidPlural;
	private final boolean obsolete;
	@Nonnull
	private String msgstr;
	@Nonnull
	private final TreeMap<Integer, String> msgstrPlural;

	/**
	 * Creates a new catalog entry.
	 *
	 * @param comments     raw comment lines preceding the entry
	 * @param msgctxt      optional message context
	 * @param msgid        the source text
	 * @param msgidPlural  optional plural source text
	 * @param msgstr       the singular translation, empty when untranslated
	 * @param msgstrPlural plural translations keyed by plural index
	 * @param obsolete     whether the entry is commented out with `#~`
	 */
	public PoEntry(
		@Nonnull List<String> comments,
		@Nullable String msgctxt,
		@Nonnull String msgid,
		@Nullable String msgidPlural,
		@Nonnull String msgstr,
		@Nonnull Map<Integer, String> msgstrPlural,
		boolean obsolete
	) {
		this.comments = new ArrayList<>(Objects.requireNonNull(comments, "comments must not be null"));
		this.msgctxt = msgctxt;
		this.msgid = Objects.requireNonNull(msgid, "msgid must not be null");
		this.msgidPlural = msgidPlural;
		this.msgstr = Objects.requireNonNull(msgstr, "msgstr must not be null");
		this.msgstrPlural = new TreeMap<>(Objects.requireNonNull(msgstrPlural, "msgstrPlural must not be null"));
		this.obsolete = obsolete;
	}

	/**
	 * Creates a simple singular entry without comments or context.
	 *
	 * @param msgid  the source text
	 * @param msgstr the translation, empty when untranslated
	 * @return a new PoEntry
	 */
	@Nonnull
	public static PoEntry singular(@Nonnull String msgid, @Nonnull String msgstr) {
		return new PoEntry(List.of(), null, msgid, null, msgstr, Map.of(), false);
	}

	/**
	 * Creates a simple plural entry without comments or context.
	 *
	 * @param msgid        the singular source text
	 * @param msgidPlural  the plural source text
	 * @param msgstrPlural the plural translations keyed by plural index
	 * @return a new PoEntry
	 */
	@Nonnull
	public static PoEntry plural(
		@Nonnull String msgid,
		@Nonnull String msgidPlural,
		@Nonnull Map<Integer, String> msgstrPlural
	) {
		return new PoEntry(List.of(), null, msgid, msgidPlural, "", msgstrPlural, false);
	}

	@Nonnull
	public List<String> getComments() {
		return Collections.unmodifiableList(this.comments);
	}

	/**
	 * Returns the flags listed on `#,` comment lines, e.g. `fuzzy` or `c-format`.
	 *
	 * @return flags in order of appearance
	 */
	@Nonnull
	public List<String> getFlags() {
		final List<String> flags = new ArrayList<>();
		for (final String comment : this.comments) {
			if (comment.startsWith("#,")) {
				Arrays.stream(comment.substring(2).split(","))
					.map(String::trim)
					.filter(flag -> !flag.isEmpty())
					.forEach(flags::add);
			}
		}
		return flags;
	}

	@Nullable
	public String getMsgctxt() {
		return this.msgctxt;
	}

	@Nonnull
	public String getMsgid() {
		return this.msgid;
	}

	@Nullable
	public String getMsgidPlural() {
		return this.msgidPlural;
	}

	@Nonnull
	public String getMsgstr() {
		return this.msgstr;
	}

	@Nonnull
	public SortedMap<Integer, String> getMsgstrPlural() {
		return Collections.unmodifiableSortedMap(this.msgstrPlural);
	}

	public boolean isObsolete() {
		return this.obsolete;
	}

	public boolean isPlural() {
		return this.msgidPlural != null;
	}

	/**
	 * Returns true for the catalog header, the entry with an empty `msgid` and no context.
	 *
	 * @return true if this entry carries the catalog metadata
	 */
	public boolean isHeader() {
		return this.msgid.isEmpty() && this.msgctxt == null && !this.obsolete;
	}

	/**
	 * Returns the source text a field is translated from. Plural form 0 is the singular `msgid`,
	 * all other plural forms use `msgid_plural`.
	 *
	 * @param pluralIndex {@link EntryKey#PRIMARY} or a plural index
	 * @return the source text of the field
	 */
	@Nonnull
	public String getSourceText(int pluralIndex) {
		if (pluralIndex == EntryKey.PRIMARY || pluralIndex == 0 || this.msgidPlural == null) {
			return this.msgid;
		}
		return this.msgidPlural;
	}

	/**
	 * Returns the current translation of a field, empty if untranslated.
	 *
	 * @param pluralIndex {@link EntryKey#PRIMARY} or a plural index
	 * @return the translation of the field
	 */
	@Nonnull
	public String getTranslation(int pluralIndex) {
		if (pluralIndex == EntryKey.PRIMARY) {
			return this.msgstr;
		}
		return this.msgstrPlural.getOrDefault(pluralIndex, "");
	}

	/**
	 * Sets the translation of a field.
	 *
	 * @param pluralIndex {@link EntryKey#PRIMARY} or a plural index
	 * @param translation the new translation
	 */
	public void setTranslation(int pluralIndex, @Nonnull String translation) {
		Objects.requireNonNull(translation, "translation must not be null");
		if (pluralIndex == EntryKey.PRIMARY) {
			this.msgstr = translation;
		} else {
			this.msgstrPlural.put(pluralIndex, translation);
		}
	}

	/**
	 * Creates an independent copy of this entry.
	 *
	 * @return a deep copy
	 */
	@Nonnull
	public PoEntry copy() {
		return new PoEntry(this.comments, this.msgctxt, this.msgid, this.msgidPlural, this.msgstr, this.msgstrPlural, this.obsolete);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PoEntry that)) return false;
		return this.obsolete == that.obsolete &&
			this.comments.equals(that.comments) &&
			Objects.equals(this.msgctxt, that.msgctxt) &&
			this.msgid.equals(that.msgid) &&
			Objects.equals(this.msgidPlural, that.msgidPlural) &&
			this.msgstr.equals(that.msgstr) &&
			this.msgstrPlural.equals(that.msgstrPlural);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.comments, this.msgctxt, this.msgid, this.msgidPlural, this.msgstr, this.msgstrPlural, this.obsolete);
	}

	@Override
	public String toString() {
		return "PoEntry[msgid=" + this.msgid + (this.obsolete ? ", obsolete" : "") + "]";
	}
}
