package io.evitadb.lingua.cache;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Computes cache keys for translations. The key is a SHA-256 digest of the NFC-normalized text
 * bound to the language pair, prefixed with the pair itself so that cache files stay readable:
 * `en:fa:3a7bd3e2...`.
 */
public final class CacheFingerprint {

	private static final char SEPARATOR = '\u0000';

	private CacheFingerprint() {
		// Utility class - prevent instantiation
	}

	/**
	 * Computes the fingerprint of a text under a language pair.
	 *
	 * @param text       the source text
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @return deterministic cache key
	 */
	@Nonnull
	public static String of(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");

		final String material = sourceLang + SEPARATOR + targetLang + SEPARATOR + normalize(text);
		return sourceLang + ":" + targetLang + ":" + HexFormat.of().formatHex(sha256(material));
	}

	/**
	 * Normalizes text so that canonically equivalent Unicode sequences share one cache entry.
	 *
	 * @param text the text to normalize
	 * @return NFC form of the text
	 */
	@Nonnull
	static String normalize(@Nonnull String text) {
		return Normalizer.normalize(text, Normalizer.Form.NFC);
	}

	@Nonnull
	private static byte[] sha256(@Nonnull String material) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
		} catch (NoSuchAlgorithmException e) {
			// every JRE is required to provide SHA-256
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}
