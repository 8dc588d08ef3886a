package io.evitadb.lingua.backend;

import javax.annotation.Nonnull;

/**
 * Capability to translate a single text between two languages.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface TranslationBackend {

	/**
	 * Translates the text.
	 *
	 * @param text       the text to translate, never blank
	 * @param sourceLang source language code, or `auto`
	 * @param targetLang target language code
	 * @return the translated text
	 * @throws BackendException if the text cannot be translated
	 */
	@Nonnull
	String translate(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang) throws BackendException;

	/**
	 * Returns a short name of the backend for log output.
	 *
	 * @return backend name
	 */
	@Nonnull
	String name();
}
