package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable record representing the outcome of a single translation task.
 * A degraded result carries the original source text because the backend could not translate it;
 * its text is never empty unless the source itself was empty.
 *
 * @param key            identity of the catalog field the result is merged into
 * @param translatedText the translated text, or the source text for degraded results
 * @param degraded       whether the backend failed and the source text was kept
 * @param fromCache      whether the translation was served by the cache
 */
public record TranslationResult(
	@Nonnull EntryKey key,
	@Nonnull String translatedText,
	boolean degraded,
	boolean fromCache
) {

	public TranslationResult {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(translatedText, "translatedText must not be null");
	}

	/**
	 * Creates a result for a translation obtained from the backend.
	 *
	 * @param task           the task that was translated
	 * @param translatedText the translated text
	 * @return a successful TranslationResult
	 */
	@Nonnull
	public static TranslationResult translated(@Nonnull TranslationTask task, @Nonnull String translatedText) {
		return new TranslationResult(task.key(), translatedText, false, false);
	}

	/**
	 * Creates a result for a translation served by the cache.
	 *
	 * @param task           the task that was looked up
	 * @param translatedText the cached translation
	 * @return a successful TranslationResult marked as cache hit
	 */
	@Nonnull
	public static TranslationResult cached(@Nonnull TranslationTask task, @Nonnull String translatedText) {
		return new TranslationResult(task.key(), translatedText, false, true);
	}

	/**
	 * Creates a degraded result that keeps the source text of the task.
	 *
	 * @param task the task that could not be translated
	 * @return a degraded TranslationResult
	 */
	@Nonnull
	public static TranslationResult degraded(@Nonnull TranslationTask task) {
		return new TranslationResult(task.key(), task.sourceText(), true, false);
	}
}
