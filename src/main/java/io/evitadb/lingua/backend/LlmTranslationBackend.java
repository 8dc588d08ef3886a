package io.evitadb.lingua.backend;

import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.lingua.Languages;
import io.evitadb.lingua.llm.LlmClient;
import io.evitadb.lingua.llm.PromptLoader;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translation backend that asks a large language model to translate one catalog message at a time.
 * Prompts come from the `translate-entry-system.txt` and `translate-entry-user.txt` templates.
 */
public final class LlmTranslationBackend implements TranslationBackend {

	static final String SYSTEM_TEMPLATE = "translate-entry-system.txt";
	static final String USER_TEMPLATE = "translate-entry-user.txt";

	/**
	 * Models sometimes wrap the answer in a fenced code block despite the instructions.
	 */
	private static final Pattern FENCED_ANSWER = Pattern.compile("^```[\\w-]*\\n(.*)\\n```$", Pattern.DOTALL);

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptLoader promptLoader;

	public LlmTranslationBackend(@Nonnull LlmClient llmClient, @Nonnull PromptLoader promptLoader) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
	}

	@Nonnull
	@Override
	public String translate(
		@Nonnull String text,
		@Nonnull String sourceLang,
		@Nonnull String targetLang
	) throws BackendException {
		final Map<String, String> placeholders = Map.of(
			"sourceLanguage", Languages.AUTO.equals(sourceLang)
				? "the language of the text" : Languages.displayName(sourceLang) + " (" + sourceLang + ")",
			"targetLanguage", Languages.displayName(targetLang) + " (" + targetLang + ")",
			"text", text
		);

		final String answer;
		try {
			answer = this.llmClient.complete(
				this.promptLoader.render(SYSTEM_TEMPLATE, placeholders),
				this.promptLoader.render(USER_TEMPLATE, placeholders)
			);
		} catch (NonRetriableException e) {
			throw new BackendException("LLM rejected the request permanently: " + e.getMessage(), e, true);
		} catch (RuntimeException e) {
			throw new BackendException("LLM call failed: " + e.getMessage(), e, this.llmClient.hasPermanentFailure());
		}

		final String translation = unwrap(answer);
		if (translation.isBlank()) {
			throw new BackendException("LLM returned an empty translation", null);
		}
		return restoreOuterWhitespace(text, translation);
	}

	@Nonnull
	@Override
	public String name() {
		return "llm";
	}

	/**
	 * Removes a surrounding code fence and trailing whitespace the source text did not have.
	 *
	 * @param answer raw model answer
	 * @return the bare translation
	 */
	@Nonnull
	static String unwrap(@Nonnull String answer) {
		final String trimmed = answer.strip();
		final Matcher matcher = FENCED_ANSWER.matcher(trimmed);
		return matcher.matches() ? matcher.group(1) : trimmed;
	}

	/**
	 * Gives the translation the same leading and trailing whitespace as the source text.
	 * Catalog messages often end with a line break or a space that models drop.
	 *
	 * @param source      the source text
	 * @param translation the stripped translation
	 * @return the translation surrounded by the source's outer whitespace
	 */
	@Nonnull
	static String restoreOuterWhitespace(@Nonnull String source, @Nonnull String translation) {
		final String leading = source.substring(0, source.length() - source.stripLeading().length());
		final String trailing = source.substring(source.stripTrailing().length());
		return leading + translation + trailing;
	}
}
