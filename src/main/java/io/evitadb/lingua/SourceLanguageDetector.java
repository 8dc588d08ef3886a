package io.evitadb.lingua;

import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.PoEntry;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Guesses the source language of a catalog when none is configured.
 *
 * The header `Language` field wins, then a language name mentioned in `Language-Team`, and finally
 * the script of a few sample message ids. The script check only tells apart a handful of writing
 * systems and falls back to English for everything else.
 */
public final class SourceLanguageDetector {

	private static final int SAMPLE_ENTRIES = 10;
	private static final int MIN_SAMPLE_LENGTH = 10;
	private static final Set<String> ISO_LANGUAGES = Set.of(Locale.getISOLanguages());

	private SourceLanguageDetector() {
		// Utility class - prevent instantiation
	}

	/**
	 * Detects the source language of the catalog.
	 *
	 * @param catalog the catalog to inspect
	 * @return a language code, or {@link Languages#AUTO} when nothing could be detected
	 */
	@Nonnull
	public static String detect(@Nonnull PoCatalog catalog) {
		return fromLanguageHeader(catalog)
			.or(() -> fromLanguageTeam(catalog))
			.or(() -> fromScript(catalog))
			.orElse(Languages.AUTO);
	}

	@Nonnull
	private static Optional<String> fromLanguageHeader(@Nonnull PoCatalog catalog) {
		return catalog.getMetadata("Language")
			.map(Languages::normalize)
			.filter(ISO_LANGUAGES::contains);
	}

	@Nonnull
	private static Optional<String> fromLanguageTeam(@Nonnull PoCatalog catalog) {
		final Optional<String> team = catalog.getMetadata("Language-Team")
			.map(value -> value.toLowerCase(Locale.ROOT));
		if (team.isEmpty()) {
			return Optional.empty();
		}
		return Languages.COMMON_CODES.stream()
			.filter(code -> team.get().contains(Languages.displayName(code).toLowerCase(Locale.ROOT)))
			.findFirst();
	}

	@Nonnull
	private static Optional<String> fromScript(@Nonnull PoCatalog catalog) {
		final List<String> samples = catalog.getEntries().stream()
			.filter(entry -> !entry.isHeader())
			.limit(SAMPLE_ENTRIES)
			.map(PoEntry::getMsgid)
			.filter(msgid -> msgid.length() > MIN_SAMPLE_LENGTH)
			.collect(Collectors.toList());
		if (samples.isEmpty()) {
			return Optional.empty();
		}

		final String text = String.join(" ", samples);
		if (containsScript(text, Character.UnicodeScript.CYRILLIC)) {
			return Optional.of("ru");
		} else if (containsScript(text, Character.UnicodeScript.ARABIC)) {
			return Optional.of("ar");
		} else if (containsScript(text, Character.UnicodeScript.HIRAGANA) || containsScript(text, Character.UnicodeScript.KATAKANA)) {
			// kana is checked before Han because Japanese text mixes both
			return Optional.of("ja");
		} else if (containsScript(text, Character.UnicodeScript.HANGUL)) {
			return Optional.of("ko");
		} else if (containsScript(text, Character.UnicodeScript.HAN)) {
			return Optional.of("zh");
		}
		return Optional.of("en");
	}

	private static boolean containsScript(@Nonnull String text, @Nonnull Character.UnicodeScript script) {
		return text.codePoints().anyMatch(cp -> Character.UnicodeScript.of(cp) == script);
	}
}
