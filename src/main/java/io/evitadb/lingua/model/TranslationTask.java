package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable unit of work handed to the worker pool: the field to fill and the text to translate.
 *
 * @param key        identity of the catalog field the translation belongs to
 * @param sourceText the source language text
 */
public record TranslationTask(
	@Nonnull EntryKey key,
	@Nonnull String sourceText
) {

	public TranslationTask {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(sourceText, "sourceText must not be null");
	}
}
