package io.evitadb.lingua.model;

import javax.annotation.Nonnull;

/**
 * Identity of a single translatable field inside a catalog: the position of the entry
 * and the field selector. The selector is either {@link #PRIMARY} for the singular
 * `msgstr` or the zero-based index of a plural form (`msgstr[n]`).
 *
 * @param index       zero-based position of the entry in the catalog
 * @param pluralIndex {@link #PRIMARY} or the plural form index
 */
public record EntryKey(int index, int pluralIndex) {

	/**
	 * Field selector of the singular translation.
	 */
	public static final int PRIMARY = -1;

	public EntryKey {
		if (index < 0) {
			throw new IllegalArgumentException("index must not be negative");
		}
		if (pluralIndex < PRIMARY) {
			throw new IllegalArgumentException("pluralIndex must be PRIMARY or a non-negative plural index");
		}
	}

	@Nonnull
	public static EntryKey primary(int index) {
		return new EntryKey(index, PRIMARY);
	}

	@Nonnull
	public static EntryKey plural(int index, int pluralIndex) {
		if (pluralIndex < 0) {
			throw new IllegalArgumentException("pluralIndex must not be negative");
		}
		return new EntryKey(index, pluralIndex);
	}

	public boolean isPlural() {
		return this.pluralIndex != PRIMARY;
	}

	@Override
	public String toString() {
		return this.pluralIndex == PRIMARY ? "#" + this.index : "#" + this.index + "[" + this.pluralIndex + "]";
	}
}
