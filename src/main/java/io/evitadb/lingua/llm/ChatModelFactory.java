package io.evitadb.lingua.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory for LangChain4j chat models used as translation backends.
 * Supports OpenAI-compatible endpoints (OpenAI, Groq, Ollama, DeepSeek, LibreChat gateways, ...)
 * and Anthropic.
 */
public final class ChatModelFactory {

	/**
	 * Catalog entries are short, so a single call should never take long.
	 */
	private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);
	private static final double DEFAULT_TEMPERATURE = 0.1;
	private static final int DEFAULT_MAX_RETRIES = 2;
	private static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-5-haiku-20241022";
	private static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
	private static final String DEFAULT_ANTHROPIC_URL = "https://api.anthropic.com/v1/";

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel for the given provider.
	 *
	 * @param provider  `openai` or `anthropic`
	 * @param llmUrl    base URL of the endpoint, null or blank for the provider's public API
	 * @param llmToken  API key, may be null for local endpoints
	 * @param modelName model name, null or blank for the provider default
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if the provider is unknown
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nullable String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		Objects.requireNonNull(provider, "provider must not be null");

		return switch (provider.trim().toLowerCase(Locale.ROOT)) {
			case PROVIDER_OPENAI -> OpenAiChatModel.builder()
				.baseUrl(orDefault(llmUrl, DEFAULT_OPENAI_URL))
				// OpenAI-compatible local servers accept any key but the client requires one
				.apiKey(isBlank(llmToken) ? "none" : llmToken)
				.modelName(orDefault(modelName, DEFAULT_OPENAI_MODEL))
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(DEFAULT_MAX_RETRIES)
				.logRequests(false)
				.logResponses(false)
				.build();
			case PROVIDER_ANTHROPIC -> AnthropicChatModel.builder()
				.baseUrl(orDefault(llmUrl, DEFAULT_ANTHROPIC_URL))
				.apiKey(llmToken)
				.modelName(orDefault(modelName, DEFAULT_ANTHROPIC_MODEL))
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(DEFAULT_MAX_RETRIES)
				.logRequests(false)
				.logResponses(false)
				.build();
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + provider + ". Supported providers: " + PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC
			);
		};
	}

	@Nonnull
	private static String orDefault(@Nullable String value, @Nonnull String defaultValue) {
		if (isBlank(value)) {
			return defaultValue;
		}
		String normalized = value.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}
}
