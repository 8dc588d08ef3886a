package io.evitadb.lingua.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmClient completions and permanent failure handling")
class LlmClientTest {

	private ChatModel mockModel;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
	}

	@Test
	@DisplayName("sends system and user message and returns the answer")
	void shouldReturnAnswer() {
		when(mockModel.chat(anyList())).thenReturn(response("Salam", 12, 3));

		final LlmClient client = new LlmClient(mockModel);

		assertEquals("Salam", client.complete("system", "Hello"));
		verify(mockModel).chat(List.of(SystemMessage.from("system"), UserMessage.from("Hello")));
	}

	@Test
	@DisplayName("accumulates token usage")
	void shouldAccumulateTokenUsage() {
		when(mockModel.chat(anyList())).thenReturn(response("a", 10, 2), response("b", 5, 1));

		final LlmClient client = new LlmClient(mockModel);
		client.complete("s", "u");
		client.complete("s", "u");

		assertEquals(15, client.getInputTokens());
		assertEquals(3, client.getOutputTokens());
	}

	@Test
	@DisplayName("sets permanent failure flag on auth error")
	void shouldSetPermanentFailureFlag() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final LlmClient client = new LlmClient(mockModel);

		assertFalse(client.hasPermanentFailure());
		assertThrows(NonRetriableException.class, () -> client.complete("s", "u"));
		assertTrue(client.hasPermanentFailure());
		assertNotNull(client.getFailureCause());
	}

	@Test
	@DisplayName("fast-fails after permanent failure without calling the model")
	void shouldFastFailAfterPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final LlmClient client = new LlmClient(mockModel);
		assertThrows(NonRetriableException.class, () -> client.complete("s", "u"));

		final LangChain4jException thrown = assertThrows(LangChain4jException.class, () -> client.complete("s", "again"));
		assertTrue(thrown.getMessage().contains("permanent failure"));
		verify(mockModel, times(1)).chat(anyList());
	}

	@Test
	@DisplayName("propagates retriable exceptions without disabling the client")
	void shouldPropagateRetriableException() {
		when(mockModel.chat(anyList())).thenThrow(new RateLimitException("Rate limit exceeded"));

		final LlmClient client = new LlmClient(mockModel);

		assertThrows(RateLimitException.class, () -> client.complete("s", "u"));
		assertFalse(client.hasPermanentFailure());
		assertNull(client.getFailureCause());
	}

	@Test
	@DisplayName("returns empty text when the model answers nothing")
	void shouldReturnEmptyTextForMissingAnswer() {
		when(mockModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("")).build());

		assertEquals("", new LlmClient(mockModel).complete("s", "u"));
	}

	private static ChatResponse response(String text, int input, int output) {
		return ChatResponse.builder()
			.aiMessage(AiMessage.from(text))
			.tokenUsage(new TokenUsage(input, output))
			.build();
	}
}
