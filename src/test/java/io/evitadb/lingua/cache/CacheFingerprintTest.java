package io.evitadb.lingua.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheFingerprint computes stable cache keys")
class CacheFingerprintTest {

	@Test
	@DisplayName("is deterministic and prefixed with the language pair")
	void shouldBeDeterministic() {
		final String key = CacheFingerprint.of("Hello", "en", "fa");

		assertEquals(key, CacheFingerprint.of("Hello", "en", "fa"));
		assertTrue(key.startsWith("en:fa:"));
		assertEquals("en:fa:".length() + 64, key.length());
	}

	@Test
	@DisplayName("differs by text and language pair")
	void shouldDifferByInput() {
		final String key = CacheFingerprint.of("Hello", "en", "fa");

		assertNotEquals(key, CacheFingerprint.of("Hello!", "en", "fa"));
		assertNotEquals(key, CacheFingerprint.of("Hello", "en", "de"));
		assertNotEquals(key, CacheFingerprint.of("Hello", "auto", "fa"));
	}

	@Test
	@DisplayName("treats canonically equivalent text as the same")
	void shouldNormalizeUnicode() {
		final String composed = "caf\u00e9";
		final String decomposed = "cafe\u0301";

		assertNotEquals(composed, decomposed);
		assertEquals(CacheFingerprint.of(composed, "fr", "en"), CacheFingerprint.of(decomposed, "fr", "en"));
	}

	@Test
	@DisplayName("keeps surrounding whitespace significant")
	void shouldKeepWhitespace() {
		assertNotEquals(CacheFingerprint.of("Hello", "en", "fa"), CacheFingerprint.of("Hello\n", "en", "fa"));
	}
}
