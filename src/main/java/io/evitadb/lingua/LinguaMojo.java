package io.evitadb.lingua;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.lingua.backend.EchoTranslationBackend;
import io.evitadb.lingua.backend.LlmTranslationBackend;
import io.evitadb.lingua.backend.TranslationBackend;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.checkpoint.CheckpointManager;
import io.evitadb.lingua.llm.ChatModelFactory;
import io.evitadb.lingua.llm.LlmClient;
import io.evitadb.lingua.llm.PromptLoader;
import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.TranslationSummary;
import io.evitadb.lingua.pipeline.CancellationToken;
import io.evitadb.lingua.pipeline.PipelineConfig;
import io.evitadb.lingua.pipeline.PipelineException;
import io.evitadb.lingua.pipeline.TranslationPipeline;
import io.evitadb.lingua.po.PoCatalogIo;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main Mojo for Lingua plugin providing actions:
 * - show-config: prints current configuration
 * - translate: translates the untranslated entries of a PO catalog
 * - list-languages: prints the commonly used language codes
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class LinguaMojo extends AbstractMojo {

	static final String PROVIDER_ECHO = "echo";

	/** Which action to perform: "show-config", "translate" or "list-languages". */
	@Parameter(property = "lingua.action", defaultValue = "show-config")
	private String action;

	/** PO catalog to translate (no default). */
	@Parameter(property = "lingua.inputFile")
	private String inputFile;

	/** Output catalog, defaults to the input name with the target language inserted before the extension. */
	@Parameter(property = "lingua.outputFile")
	private String outputFile;

	/** Source language code, detected from the catalog when not set. */
	@Parameter(property = "lingua.sourceLanguage")
	private String sourceLanguage;

	/** Target language code. */
	@Parameter(property = "lingua.targetLanguage", defaultValue = "fa")
	private String targetLanguage = "fa";

	/** Translation provider: "openai", "anthropic" or "echo". */
	@Parameter(property = "lingua.provider", defaultValue = "openai")
	private String provider = "openai";

	/** LLM URL, defaults to the provider's public API. */
	@Parameter(property = "lingua.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "lingua.llmToken")
	private String llmToken;

	/** LLM model name, defaults to the provider's default model. */
	@Parameter(property = "lingua.llmModel")
	private String llmModel;

	/** Number of entries dispatched to the workers at once (default 10). */
	@Parameter(property = "lingua.batchSize", defaultValue = "10")
	private int batchSize = PipelineConfig.DEFAULT_BATCH_SIZE;

	/** Number of parallel translation threads (default 4). */
	@Parameter(property = "lingua.parallelism", defaultValue = "4")
	private int parallelism = PipelineConfig.DEFAULT_PARALLELISM;

	/** Number of translations between progress saves (default 50). */
	@Parameter(property = "lingua.checkpointInterval", defaultValue = "50")
	private int checkpointInterval = PipelineConfig.DEFAULT_CHECKPOINT_INTERVAL;

	/** When true, entries that already have a translation are left untouched. */
	@Parameter(property = "lingua.keepExisting", defaultValue = "false")
	private boolean keepExisting;

	/** When true, translations are cached on disk and reused across runs. */
	@Parameter(property = "lingua.useCache", defaultValue = "true")
	private boolean useCache = true;

	/** Cache file, defaults to a hidden file next to the output catalog. */
	@Parameter(property = "lingua.cacheFile")
	private String cacheFile;

	/** Number of new cache entries between cache saves (default 100). */
	@Parameter(property = "lingua.cacheFlushInterval", defaultValue = "100")
	private int cacheFlushInterval = 100;

	/** Pause of each worker after a backend call in milliseconds (default 500). */
	@Parameter(property = "lingua.requestDelayMillis", defaultValue = "500")
	private long requestDelayMillis = PipelineConfig.DEFAULT_REQUEST_DELAY.toMillis();

	/** How long the final save may take before it is left running in the background (default 30). */
	@Parameter(property = "lingua.finalSaveTimeoutSeconds", defaultValue = "30")
	private long finalSaveTimeoutSeconds = PipelineConfig.DEFAULT_FINAL_SAVE_TIMEOUT.toSeconds();

	@Nullable
	private TranslationSummary lastSummary;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			case "list-languages":
				listLanguages(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, translate, list-languages");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Lingua Plugin Configuration:");
		log.info(" - inputFile: " + orNotSet(this.inputFile));
		if (isBlank(this.inputFile)) {
			log.warn("Input file is not set");
		}
		log.info(" - outputFile: " + (isBlank(this.outputFile) ? "<derived from input>" : this.outputFile));
		log.info(" - sourceLanguage: " + (isBlank(this.sourceLanguage) ? "<detected>" : this.sourceLanguage));
		log.info(" - targetLanguage: " + orNotSet(this.targetLanguage));
		log.info(" - provider: " + this.provider);
		log.info(" - llmUrl: " + (isBlank(this.llmUrl) ? "<provider default>" : this.llmUrl));
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken) && !PROVIDER_ECHO.equalsIgnoreCase(this.provider)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - batchSize: " + this.batchSize);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - checkpointInterval: " + this.checkpointInterval);
		log.info(" - keepExisting: " + this.keepExisting);
		log.info(" - useCache: " + this.useCache);
		log.info(" - cacheFile: " + (isBlank(this.cacheFile) ? "<next to output>" : this.cacheFile));
		log.info(" - cacheFlushInterval: " + this.cacheFlushInterval);
		log.info(" - requestDelayMillis: " + this.requestDelayMillis);
		log.info(" - finalSaveTimeoutSeconds: " + this.finalSaveTimeoutSeconds);
	}

	private static void listLanguages(@Nonnull final Log log) {
		log.info("Commonly used language codes:");
		for (final String code : Languages.COMMON_CODES) {
			log.info(" - " + code + ": " + Languages.displayName(code));
		}
		log.info("Any other ISO 639-1 code is accepted as well.");
	}

	@Nonnull
	private static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		final PipelineConfig config = validate();
		final Path input = Path.of(this.inputFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(input)) {
			throw new MojoExecutionException("Input file does not exist or is not a file: " + input);
		}
		final String target = Languages.normalize(this.targetLanguage);
		final Path output = isBlank(this.outputFile)
			? deriveOutputFile(input, target)
			: Path.of(this.outputFile).toAbsolutePath().normalize();

		final PoCatalogIo catalogIo = new PoCatalogIo();
		final PoCatalog catalog;
		try {
			catalog = catalogIo.load(input);
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to load " + input + ": " + e.getMessage(), e);
		}

		final String source;
		if (isBlank(this.sourceLanguage)) {
			source = SourceLanguageDetector.detect(catalog);
			log.info("Detected source language: " + Languages.displayName(source) + " (" + source + ")");
		} else {
			source = Languages.normalize(this.sourceLanguage);
		}
		log.info("Translating " + input + " from " + Languages.displayName(source) + " to " +
			Languages.displayName(target) + " into " + output);

		final LlmClient llmClient = createLlmClient();
		final TranslationBackend backend = llmClient == null
			? new EchoTranslationBackend()
			: new LlmTranslationBackend(llmClient, new PromptLoader());
		final TranslationCache cache = openCache(output, target, log);
		final CancellationToken token = new CancellationToken();
		final CountDownLatch finished = new CountDownLatch(1);
		final AtomicReference<TranslationPipeline> running = new AtomicReference<>();
		final Thread shutdownHook = new Thread(
			() -> awaitShutdown(token, finished, running, config.finalSaveTimeout(), log),
			"lingua-shutdown"
		);

		try (CheckpointManager checkpoints = new CheckpointManager(output, catalogIo, log)) {
			final TranslationPipeline pipeline = new TranslationPipeline(config, backend, cache, checkpoints, token, log);
			running.set(pipeline);
			Runtime.getRuntime().addShutdownHook(shutdownHook);
			try {
				this.lastSummary = pipeline.run(catalog, source, target);
			} catch (PipelineException e) {
				this.lastSummary = e.getSummary();
				throw new MojoExecutionException(e.getMessage(), e);
			} finally {
				finished.countDown();
				removeShutdownHook(shutdownHook, log);
			}

			if (!pipeline.awaitPendingSave(config.finalSaveTimeout())) {
				log.warn("[CHECKPOINT] Final save of " + output + " is still running");
			}
			log.info("Summary: " + this.lastSummary);
			if (cache.isEnabled()) {
				log.info("[CACHE] " + cache.size() + " entries, " + cache.getHits() + " hits, " + cache.getMisses() +
					" misses, " + cache.getStores() + " new translations stored in " + cache.getFile());
			}
		} finally {
			if (llmClient != null) {
				log.info("Input tokens: " + llmClient.getInputTokens());
				log.info("Output tokens: " + llmClient.getOutputTokens());
			}
		}
	}

	@Nonnull
	private PipelineConfig validate() throws MojoExecutionException {
		if (isBlank(this.inputFile)) {
			throw new MojoExecutionException("Input file must be specified for translate action");
		}
		if (isBlank(this.targetLanguage) || Languages.AUTO.equals(Languages.normalize(this.targetLanguage))) {
			throw new MojoExecutionException("Target language must be a concrete language code");
		}
		if (isBlank(this.provider)) {
			throw new MojoExecutionException("Provider must be specified for translate action");
		}
		if (this.cacheFlushInterval < 1) {
			throw new MojoExecutionException("cacheFlushInterval must be at least 1");
		}
		try {
			return new PipelineConfig(
				this.batchSize,
				this.parallelism,
				this.checkpointInterval,
				!this.keepExisting,
				Duration.ofMillis(this.requestDelayMillis),
				PipelineConfig.defaults().pollTimeout(),
				Duration.ofSeconds(this.finalSaveTimeoutSeconds)
			);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}
	}

	@Nullable
	private LlmClient createLlmClient() throws MojoExecutionException {
		if (PROVIDER_ECHO.equalsIgnoreCase(this.provider)) {
			return null;
		}
		try {
			final ChatModel chatModel = ChatModelFactory.create(this.provider, this.llmUrl, this.llmToken, this.llmModel);
			return new LlmClient(chatModel);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException(e.getMessage() + ", " + PROVIDER_ECHO, e);
		}
	}

	@Nonnull
	private TranslationCache openCache(@Nonnull Path output, @Nonnull String target, @Nonnull Log log) {
		if (!this.useCache) {
			log.info("[CACHE] Translation cache is disabled");
			return TranslationCache.disabled(log);
		}
		final Path file = isBlank(this.cacheFile)
			? TranslationCache.defaultLocation(output, target)
			: Path.of(this.cacheFile);
		return TranslationCache.open(file, this.cacheFlushInterval, new ObjectMapper(), log);
	}

	/**
	 * Derives `<base>.<target><ext>` from the input file, e.g. `messages.po` → `messages.fa.po`.
	 */
	@Nonnull
	static Path deriveOutputFile(@Nonnull Path input, @Nonnull String target) {
		final String name = input.getFileName().toString();
		final int dot = name.lastIndexOf('.');
		final String derived = dot <= 0
			? name + "." + target
			: name.substring(0, dot) + "." + target + name.substring(dot);
		return input.resolveSibling(derived);
	}

	private static void awaitShutdown(
		@Nonnull CancellationToken token,
		@Nonnull CountDownLatch finished,
		@Nonnull AtomicReference<TranslationPipeline> running,
		@Nonnull Duration timeout,
		@Nonnull Log log
	) {
		if (token.cancel()) {
			log.warn("[CANCEL] Interrupt received. Saving progress before exiting...");
		}
		try {
			if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				log.warn("[CANCEL] Translation did not stop within " + timeout.toSeconds() + "s");
				return;
			}
			final TranslationPipeline pipeline = running.get();
			if (pipeline != null && !pipeline.awaitPendingSave(timeout)) {
				log.warn("[CANCEL] Final save did not finish within " + timeout.toSeconds() + "s");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(@Nonnull Thread hook, @Nonnull Log log) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			// the JVM is already shutting down and the hook is running
			log.debug("Shutdown in progress, hook stays registered");
		}
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	/**
	 * Returns the statistics of the last translate action.
	 *
	 * @return summary of the last run, null before the first run
	 */
	@Nullable
	TranslationSummary getLastSummary() {
		return this.lastSummary;
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setInputFile(@Nullable final String inputFile) { this.inputFile = inputFile; }
	void setOutputFile(@Nullable final String outputFile) { this.outputFile = outputFile; }
	void setSourceLanguage(@Nullable final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargetLanguage(@Nullable final String targetLanguage) { this.targetLanguage = targetLanguage; }
	void setProvider(@Nullable final String provider) { this.provider = provider == null ? null : provider.toLowerCase(Locale.ROOT); }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setBatchSize(final int batchSize) { this.batchSize = batchSize; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setCheckpointInterval(final int checkpointInterval) { this.checkpointInterval = checkpointInterval; }
	void setKeepExisting(final boolean keepExisting) { this.keepExisting = keepExisting; }
	void setUseCache(final boolean useCache) { this.useCache = useCache; }
	void setCacheFile(@Nullable final String cacheFile) { this.cacheFile = cacheFile; }
	void setCacheFlushInterval(final int cacheFlushInterval) { this.cacheFlushInterval = cacheFlushInterval; }
	void setRequestDelayMillis(final long requestDelayMillis) { this.requestDelayMillis = requestDelayMillis; }
	void setFinalSaveTimeoutSeconds(final long finalSaveTimeoutSeconds) { this.finalSaveTimeoutSeconds = finalSaveTimeoutSeconds; }
}
