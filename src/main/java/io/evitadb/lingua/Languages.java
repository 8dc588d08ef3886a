package io.evitadb.lingua;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;

/**
 * Language code helpers shared by the plugin actions and the translation backends.
 * Codes are ISO 639-1 two-letter codes; `auto` stands for an undetected source language.
 */
public final class Languages {

	public static final String AUTO = "auto";

	/**
	 * Languages listed by the `list-languages` action. Any other ISO code is accepted as well.
	 */
	public static final List<String> COMMON_CODES = List.of(
		"ar", "de", "en", "es", "fa", "fr", "hi", "id", "it", "ja", "ko", "pt", "ru", "tr", "zh"
	);

	private Languages() {
		// Utility class - prevent instantiation
	}

	/**
	 * Reduces a locale identifier such as `pt_BR` or `zh-Hans` to its lower-case language code.
	 *
	 * @param code the locale identifier
	 * @return the language code, or {@link #AUTO} for blank input
	 */
	@Nonnull
	public static String normalize(@Nullable String code) {
		if (code == null || code.isBlank()) {
			return AUTO;
		}
		final String trimmed = code.trim();
		final int separator = indexOfSeparator(trimmed);
		return (separator < 0 ? trimmed : trimmed.substring(0, separator)).toLowerCase(Locale.ROOT);
	}

	/**
	 * Returns the English display name of a language code, or the code itself when unknown.
	 *
	 * @param code the language code
	 * @return human readable language name
	 */
	@Nonnull
	public static String displayName(@Nonnull String code) {
		if (AUTO.equals(code)) {
			return "auto-detected";
		}
		final String name = Locale.forLanguageTag(normalize(code)).getDisplayLanguage(Locale.ENGLISH);
		return name == null || name.isBlank() ? code : name;
	}

	private static int indexOfSeparator(@Nonnull String code) {
		for (int i = 0; i < code.length(); i++) {
			final char c = code.charAt(i);
			if (c == '_' || c == '-' || c == '.' || c == '@') {
				return i;
			}
		}
		return -1;
	}
}
