package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.backend.TranslationBackend;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.checkpoint.CheckpointManager;
import io.evitadb.lingua.checkpoint.CheckpointOutcome;
import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.model.RunStatus;
import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.TranslationSummary;
import io.evitadb.lingua.model.TranslationTask;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a translation run over one catalog: extracts the tasks, dispatches them batch by batch to
 * a {@link WorkerPool}, merges each batch into the catalog as soon as it completes, writes periodic
 * checkpoints and finally persists the catalog and flushes the cache.
 *
 * The catalog is modified only by the thread calling {@link #run}; workers never touch it.
 * Batches are processed strictly one after another, which bounds the number of backend calls in
 * flight by the number of workers.
 *
 * Whatever the outcome (completion, cancellation, unexpected failure) the run ends with an attempt
 * to persist everything merged so far. Re-running with retranslation disabled resumes the work.
 */
public final class TranslationPipeline {

	@Nonnull
	private final PipelineConfig config;
	@Nonnull
	private final TranslationBackend backend;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final CheckpointManager checkpoints;
	@Nonnull
	private final CancellationToken token;
	@Nonnull
	private final Log log;

	@Nullable
	private volatile CompletableFuture<CheckpointOutcome> pendingSave;
	/**
	 * Statistics of the batches merged so far in the current run.
	 */
	@Nonnull
	private TranslationSummary progress = TranslationSummary.started(0);

	/**
	 * Creates a pipeline for a single run.
	 *
	 * @param config      run tuning
	 * @param backend     backend translating cache misses
	 * @param cache       translation cache, possibly disabled
	 * @param checkpoints checkpoint manager of the output file
	 * @param token       cancellation token of the run
	 * @param log         Maven log for output
	 */
	public TranslationPipeline(
		@Nonnull PipelineConfig config,
		@Nonnull TranslationBackend backend,
		@Nonnull TranslationCache cache,
		@Nonnull CheckpointManager checkpoints,
		@Nonnull CancellationToken token,
		@Nonnull Log log
	) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
		this.token = Objects.requireNonNull(token, "token must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Translates the catalog in place and persists it to the checkpoint manager's output file.
	 *
	 * @param catalog    the catalog to translate
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @return statistics of the run
	 * @throws PipelineException if the run failed unexpectedly; a final checkpoint was attempted before
	 */
	@Nonnull
	public TranslationSummary run(
		@Nonnull PoCatalog catalog,
		@Nonnull String sourceLang,
		@Nonnull String targetLang
	) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");

		final long start = System.currentTimeMillis();
		final List<TranslationTask> tasks = TaskExtractor.extract(catalog, this.config.retranslate());

		if (tasks.isEmpty()) {
			this.log.info("No entries need translation. Saving catalog as is.");
			this.token.advanceTo(RunState.STOPPED);
			final TranslationSummary summary = recordFinalCheckpoint(TranslationSummary.started(0), catalog);
			return summary.finish(RunStatus.NOTHING_TO_DO, System.currentTimeMillis() - start);
		}

		if (catalog.getMetadata("Language").isPresent()) {
			catalog.setMetadata("Language", targetLang);
		}

		this.log.info("Found " + tasks.size() + " entries that need translation (" + sourceLang + " -> " + targetLang +
			", backend " + this.backend.name() + ", " + this.config.parallelism() + " workers)");
		this.log.info("Progress will be saved every " + this.config.checkpointInterval() + " translations");

		this.progress = TranslationSummary.started(tasks.size());
		try {
			translateBatches(catalog, tasks, sourceLang, targetLang);
		} catch (RuntimeException e) {
			this.log.error("Translation failed: " + e.getMessage(), e);
			this.token.advanceTo(RunState.STOPPED);
			this.log.info("Attempting to save progress after error...");
			final TranslationSummary failed = recordFinalCheckpoint(this.progress, catalog);
			this.cache.flush();
			logResumeHint();
			throw new PipelineException(
				"Translation failed after " + failed.translatedCount() + " of " + failed.totalTasks() + " entries: " + e.getMessage(),
				e,
				failed.finish(RunStatus.CANCELLED, System.currentTimeMillis() - start)
			);
		}

		TranslationSummary summary = this.progress;
		this.token.advanceTo(RunState.STOPPED);
		final boolean cancelled = this.token.isCancelled() || summary.translatedCount() < summary.totalTasks();
		summary = recordFinalCheckpoint(summary, catalog);
		this.cache.flush();

		summary = summary.finish(cancelled ? RunStatus.CANCELLED : RunStatus.COMPLETED, System.currentTimeMillis() - start);
		if (cancelled) {
			this.log.warn("Translated " + summary.translatedCount() + "/" + summary.totalTasks() + " entries before interruption.");
			logResumeHint();
		} else {
			this.log.info("Translation completed. Translated " + summary.translatedCount() + " entries. Saved to " +
				this.checkpoints.getOutputFile());
		}
		return summary;
	}

	/**
	 * Returns the final save of the last run if it is still running in the background.
	 *
	 * @return Optional containing the unfinished final save
	 */
	@Nonnull
	public Optional<CompletableFuture<CheckpointOutcome>> pendingSave() {
		final CompletableFuture<CheckpointOutcome> save = this.pendingSave;
		return save == null || save.isDone() ? Optional.empty() : Optional.of(save);
	}

	/**
	 * Waits until a final save that outlived the save timeout has finished.
	 *
	 * @param timeout maximum time to wait
	 * @return true if no save is pending anymore
	 */
	public boolean awaitPendingSave(@Nonnull Duration timeout) {
		final Optional<CompletableFuture<CheckpointOutcome>> save = pendingSave();
		if (save.isEmpty()) {
			return true;
		}
		try {
			save.get().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		} catch (ExecutionException | TimeoutException e) {
			return save.get().isDone();
		}
	}

	private void translateBatches(
		@Nonnull PoCatalog catalog,
		@Nonnull List<TranslationTask> tasks,
		@Nonnull String sourceLang,
		@Nonnull String targetLang
	) {
		final int batchSize = this.config.batchSize();
		final int batchCount = (tasks.size() + batchSize - 1) / batchSize;
		int checkpointMark = 0;

		try (WorkerPool pool = new WorkerPool(
			this.config.parallelism(), this.backend, this.cache, sourceLang, targetLang, this.token,
			this.config.requestDelay(), this.config.pollTimeout(), this.log
		)) {
			for (int batch = 0; batch < batchCount; batch++) {
				if (this.token.isCancelled()) {
					this.log.info("[CANCEL] Interrupted, not dispatching the remaining " + (batchCount - batch) + " batches");
					break;
				}

				final List<TranslationTask> batchTasks = tasks.subList(batch * batchSize, Math.min(tasks.size(), (batch + 1) * batchSize));
				final BatchOutcome outcome = pool.dispatch(batchTasks);
				merge(catalog, outcome.results());
				this.progress = this.progress.withBatch(
					outcome.results().size(),
					(int) outcome.results().stream().filter(TranslationResult::degraded).count(),
					(int) outcome.results().stream().filter(TranslationResult::fromCache).count(),
					outcome.abandoned().size()
				);
				final int translated = this.progress.translatedCount();
				final int total = this.progress.totalTasks();
				this.log.info(String.format(
					"Progress: %d%% (%d/%d), batch %d/%d", 100L * translated / total, translated, total, batch + 1, batchCount
				));

				final int mark = translated / this.config.checkpointInterval();
				if (mark > checkpointMark && translated < total) {
					checkpointMark = mark;
					this.log.info("Saving progress after " + translated + " translations...");
					this.progress = this.progress.withCheckpoint(this.checkpoints.checkpoint(catalog, false).isPersisted());
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.token.cancel();
			this.log.warn("[CANCEL] Interrupted while waiting for workers");
		}
	}

	/**
	 * Applies results to the catalog by their entry identity. Results of one batch address distinct
	 * fields, so the order in which they are applied does not matter.
	 *
	 * @param catalog the catalog to update
	 * @param results the results to apply
	 */
	static void merge(@Nonnull PoCatalog catalog, @Nonnull List<TranslationResult> results) {
		for (final TranslationResult result : results) {
			catalog.applyTranslation(result.key(), result.translatedText());
		}
	}

	/**
	 * Runs the final checkpoint on a snapshot of the catalog and waits for it at most the configured
	 * time. A save that takes longer keeps running in the background and stays observable through
	 * {@link #pendingSave()}. The save does not observe the cancellation token.
	 *
	 * @param summary current run statistics
	 * @param catalog the catalog to persist
	 * @return statistics including the outcome of the final checkpoint
	 */
	@Nonnull
	private TranslationSummary recordFinalCheckpoint(@Nonnull TranslationSummary summary, @Nonnull PoCatalog catalog) {
		final CompletableFuture<CheckpointOutcome> save = this.checkpoints.checkpointAsync(catalog.copy(), true);
		this.pendingSave = save;
		final Duration timeout = this.config.finalSaveTimeout();
		try {
			return summary.withCheckpoint(save.get(timeout.toMillis(), TimeUnit.MILLISECONDS).isPersisted());
		} catch (TimeoutException e) {
			this.log.warn("[CHECKPOINT] Final save did not finish within " + timeout.toSeconds() + "s, it continues in the background");
			return summary;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.log.warn("[CHECKPOINT] Interrupted while waiting for the final save, it continues in the background");
			return summary;
		} catch (ExecutionException e) {
			this.log.error("[CHECKPOINT] Final save failed: " + e.getCause().getMessage(), e.getCause());
			return summary.withCheckpoint(false);
		}
	}

	private void logResumeHint() {
		this.log.info("You can resume by running again with keepExisting=true (-Dlingua.keepExisting=true) " +
			"to keep existing translations.");
	}
}
