package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory PO catalog: an ordered list of entries where the optional header entry carries
 * the catalog metadata (`Language`, `Plural-Forms`, ...).
 *
 * The catalog is not thread-safe. During a translation run it is owned by the pipeline driver;
 * checkpoints work on a {@link #copy()}.
 */
public final class PoCatalog {

	private static final int DEFAULT_PLURAL_FORMS = 2;
	/** Largest plural form count used by any language gettext knows (Arabic). */
	private static final int MAX_PLURAL_FORMS = 6;
	private static final Pattern NPLURALS_PATTERN = Pattern.compile("nplurals\\s*=\\s*(\\d{1,2})(?!\\d)");

	@Nonnull
	private final List<PoEntry> entries;

	/**
	 * Creates a catalog from the given entries.
	 *
	 * @param entries the entries in file order, header included
	 */
	public PoCatalog(@Nonnull List<PoEntry> entries) {
		this.entries = new ArrayList<>(Objects.requireNonNull(entries, "entries must not be null"));
	}

	@Nonnull
	public List<PoEntry> getEntries() {
		return Collections.unmodifiableList(this.entries);
	}

	@Nonnull
	public PoEntry getEntry(int index) {
		return this.entries.get(index);
	}

	public int size() {
		return this.entries.size();
	}

	/**
	 * Returns the header entry if the catalog has one.
	 *
	 * @return Optional containing the header entry
	 */
	@Nonnull
	public Optional<PoEntry> getHeader() {
		return this.entries.stream().filter(PoEntry::isHeader).findFirst();
	}

	/**
	 * Parses the header `msgstr` into an ordered map of metadata fields.
	 *
	 * @return metadata fields, empty if there is no header
	 */
	@Nonnull
	public Map<String, String> getMetadata() {
		final Map<String, String> metadata = new LinkedHashMap<>();
		getHeader().ifPresent(header -> {
			for (final String line : header.getMsgstr().split("\n")) {
				final int colon = line.indexOf(':');
				if (colon > 0) {
					metadata.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
				}
			}
		});
		return metadata;
	}

	@Nonnull
	public Optional<String> getMetadata(@Nonnull String key) {
		return Optional.ofNullable(getMetadata().get(key));
	}

	/**
	 * Replaces the value of an existing metadata field or appends a new one.
	 * Does nothing when the catalog has no header.
	 *
	 * @param key   the metadata field name
	 * @param value the new value
	 */
	public void setMetadata(@Nonnull String key, @Nonnull String value) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
		getHeader().ifPresent(header -> {
			final Map<String, String> metadata = getMetadata();
			metadata.put(key, value);
			final StringBuilder sb = new StringBuilder();
			for (final Map.Entry<String, String> field : metadata.entrySet()) {
				sb.append(field.getKey()).append(": ").append(field.getValue()).append('\n');
			}
			header.setTranslation(EntryKey.PRIMARY, sb.toString());
		});
	}

	/**
	 * Returns the number of plural forms declared by the `Plural-Forms` header, 2 if absent or outside
	 * of 1..{@value #MAX_PLURAL_FORMS}.
	 *
	 * @return the number of plural forms of the catalog language
	 */
	public int getPluralFormCount() {
		return getMetadata("Plural-Forms")
			.map(NPLURALS_PATTERN::matcher)
			.filter(Matcher::find)
			.map(matcher -> Integer.parseInt(matcher.group(1)))
			.filter(count -> count > 0 && count <= MAX_PLURAL_FORMS)
			.orElse(DEFAULT_PLURAL_FORMS);
	}

	@Nonnull
	public String getTranslation(@Nonnull EntryKey key) {
		return getEntry(key.index()).getTranslation(key.pluralIndex());
	}

	/**
	 * Writes a translation into the field identified by the key.
	 *
	 * @param key         the field identity
	 * @param translation the translated text
	 */
	public void applyTranslation(@Nonnull EntryKey key, @Nonnull String translation) {
		Objects.requireNonNull(key, "key must not be null");
		getEntry(key.index()).setTranslation(key.pluralIndex(), translation);
	}

	/**
	 * Counts translated fields of all live (non-header, non-obsolete) entries.
	 *
	 * @return number of non-empty translations
	 */
	public int countTranslated() {
		int count = 0;
		for (final PoEntry entry : this.entries) {
			if (entry.isHeader() || entry.isObsolete()) {
				continue;
			}
			if (entry.isPlural()) {
				count += (int) entry.getMsgstrPlural().values().stream().filter(s -> !s.isEmpty()).count();
			} else if (!entry.getMsgstr().isEmpty()) {
				count++;
			}
		}
		return count;
	}

	/**
	 * Creates an independent deep copy of the catalog.
	 *
	 * @return a snapshot that is not affected by later changes of this catalog
	 */
	@Nonnull
	public PoCatalog copy() {
		final List<PoEntry> copies = new ArrayList<>(this.entries.size());
		for (final PoEntry entry : this.entries) {
			copies.add(entry.copy());
		}
		return new PoCatalog(copies);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PoCatalog that)) return false;
		return this.entries.equals(that.entries);
	}

	@Override
	public int hashCode() {
		return this.entries.hashCode();
	}
}
