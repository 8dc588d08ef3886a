package io.evitadb.lingua.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe wrapper of a LangChain4j {@link ChatModel} shared by all translation workers.
 *
 * LangChain4j retries transient errors internally. This client adds:
 * - fast-fail of every later call once a {@link NonRetriableException} (bad key, exhausted quota) was seen,
 *   so that workers do not keep hammering a dead endpoint
 * - token usage accounting across workers
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicReference<NonRetriableException> permanentFailure = new AtomicReference<>();
	private final AtomicLong inputTokens = new AtomicLong();
	private final AtomicLong outputTokens = new AtomicLong();

	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends a system and a user message and returns the text of the model's answer.
	 *
	 * @param systemPrompt the system instructions
	 * @param userPrompt   the user message
	 * @return the answer text, empty if the model returned none
	 * @throws NonRetriableException if the model reported a permanent failure
	 * @throws LangChain4jException  for other LLM errors, or if a permanent failure happened before
	 */
	@Nonnull
	public String complete(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");

		final NonRetriableException previous = this.permanentFailure.get();
		if (previous != null) {
			throw new LangChain4jException("LLM client disabled after permanent failure: " + previous.getMessage(), previous);
		}

		final List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
		final ChatResponse response;
		try {
			response = this.model.chat(messages);
		} catch (NonRetriableException e) {
			this.permanentFailure.compareAndSet(null, e);
			throw e;
		}

		final TokenUsage usage = response.tokenUsage();
		if (usage != null) {
			this.inputTokens.addAndGet(usage.inputTokenCount() == null ? 0 : usage.inputTokenCount());
			this.outputTokens.addAndGet(usage.outputTokenCount() == null ? 0 : usage.outputTokenCount());
		}
		final String text = response.aiMessage() == null ? null : response.aiMessage().text();
		return text == null ? "" : text;
	}

	public boolean hasPermanentFailure() {
		return this.permanentFailure.get() != null;
	}

	@Nullable
	public NonRetriableException getFailureCause() {
		return this.permanentFailure.get();
	}

	public long getInputTokens() {
		return this.inputTokens.get();
	}

	public long getOutputTokens() {
		return this.outputTokens.get();
	}
}
