package io.evitadb.lingua.backend;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.evitadb.lingua.llm.LlmClient;
import io.evitadb.lingua.llm.PromptLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmTranslationBackend translates single catalog messages")
class LlmTranslationBackendTest {

	private ChatModel mockModel;
	private LlmTranslationBackend backend;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
		backend = new LlmTranslationBackend(new LlmClient(mockModel), new PromptLoader());
	}

	@Test
	@DisplayName("renders prompts with language names and the message")
	@SuppressWarnings("unchecked")
	void shouldRenderPrompts() throws Exception {
		when(mockModel.chat(anyList())).thenReturn(answer("سلام"));

		assertEquals("سلام", backend.translate("Hello", "en", "fa"));

		final ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
		verify(mockModel).chat(captor.capture());
		final List<ChatMessage> messages = captor.getValue();
		assertEquals(2, messages.size());
		final String system = ((SystemMessage) messages.get(0)).text();
		assertTrue(system.contains("English (en)"));
		assertTrue(system.contains("Persian (fa)"));
		assertEquals("Hello", ((UserMessage) messages.get(1)).singleText());
	}

	@Test
	@DisplayName("describes undetected source language generically")
	@SuppressWarnings("unchecked")
	void shouldHandleAutoSourceLanguage() throws Exception {
		when(mockModel.chat(anyList())).thenReturn(answer("Hallo"));

		backend.translate("Hello", "auto", "de");

		final ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
		verify(mockModel).chat(captor.capture());
		assertTrue(((SystemMessage) captor.getValue().get(0)).text().contains("the language of the text"));
	}

	@Test
	@DisplayName("strips code fences and restores outer whitespace")
	void shouldCleanUpAnswer() throws Exception {
		when(mockModel.chat(anyList())).thenReturn(answer("```\nDatei speichern\n```"));

		assertEquals("Datei speichern\n", backend.translate("Save file\n", "en", "de"));
	}

	@Test
	@DisplayName("rejects empty answers")
	void shouldRejectEmptyAnswer() {
		when(mockModel.chat(anyList())).thenReturn(answer("   "));

		final BackendException e = assertThrows(BackendException.class, () -> backend.translate("Hello", "en", "fa"));
		assertFalse(e.isPermanent());
	}

	@Test
	@DisplayName("marks authentication errors as permanent")
	void shouldReportPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final BackendException first = assertThrows(BackendException.class, () -> backend.translate("Hello", "en", "fa"));
		final BackendException second = assertThrows(BackendException.class, () -> backend.translate("Bye", "en", "fa"));

		assertTrue(first.isPermanent());
		assertTrue(second.isPermanent());
		verify(mockModel, times(1)).chat(anyList());
	}

	@Test
	@DisplayName("wraps transient errors")
	void shouldWrapTransientFailure() {
		when(mockModel.chat(anyList())).thenThrow(new RateLimitException("slow down"));

		final BackendException e = assertThrows(BackendException.class, () -> backend.translate("Hello", "en", "fa"));

		assertFalse(e.isPermanent());
		assertInstanceOf(RateLimitException.class, e.getCause());
	}

	@Test
	@DisplayName("keeps leading whitespace of the source")
	void shouldRestoreLeadingWhitespace() {
		assertEquals("  Hallo ", LlmTranslationBackend.restoreOuterWhitespace("  Hello ", "Hallo"));
		assertEquals("Hallo", LlmTranslationBackend.unwrap("  Hallo \n"));
	}

	private static ChatResponse answer(String text) {
		return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
	}
}
