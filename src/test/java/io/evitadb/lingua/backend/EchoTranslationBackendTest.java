package io.evitadb.lingua.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EchoTranslationBackend returns the source text")
class EchoTranslationBackendTest {

	@Test
	@DisplayName("returns text unchanged or prefixed")
	void shouldEchoText() throws Exception {
		assertEquals("Hello", new EchoTranslationBackend().translate("Hello", "en", "fa"));
		assertEquals("[fa] Hello", new EchoTranslationBackend("[fa] ").translate("Hello", "en", "fa"));
		assertEquals("echo", new EchoTranslationBackend().name());
	}
}
