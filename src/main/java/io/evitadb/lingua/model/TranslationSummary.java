package io.evitadb.lingua.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable record containing summary statistics of a translation run.
 * Used to report the overall results to the operator.
 *
 * @param status          how the run ended
 * @param totalTasks      number of tasks extracted from the catalog
 * @param translatedCount number of results merged into the catalog (degraded ones included)
 * @param degradedCount   number of merged results that kept the source text
 * @param abandonedCount  number of dispatched tasks abandoned due to cancellation
 * @param cacheHits       number of results served by the cache
 * @param checkpoints     number of checkpoints written successfully (final one included)
 * @param lostCheckpoints number of checkpoint attempts that could not be persisted
 * @param elapsedMillis   wall time of the run
 */
public record TranslationSummary(
	@Nonnull RunStatus status,
	int totalTasks,
	int translatedCount,
	int degradedCount,
	int abandonedCount,
	int cacheHits,
	int checkpoints,
	int lostCheckpoints,
	long elapsedMillis
) {

	public TranslationSummary {
		Objects.requireNonNull(status, "status must not be null");
	}

	/**
	 * Creates an empty summary for a run with the given number of tasks.
	 *
	 * @param totalTasks number of extracted tasks
	 * @return a TranslationSummary with all counters at zero
	 */
	@Nonnull
	public static TranslationSummary started(int totalTasks) {
		return new TranslationSummary(RunStatus.COMPLETED, totalTasks, 0, 0, 0, 0, 0, 0, 0);
	}

	/**
	 * Returns the number of tasks that were neither merged nor abandoned.
	 *
	 * @return number of tasks never dispatched
	 */
	public int getRemainingCount() {
		return this.totalTasks - this.translatedCount - this.abandonedCount;
	}

	/**
	 * Returns true if every extracted task was merged into the catalog.
	 *
	 * @return true if the run is complete
	 */
	public boolean isComplete() {
		return this.status != RunStatus.CANCELLED && this.translatedCount == this.totalTasks;
	}

	/**
	 * Creates a new summary with the counts of a merged batch added.
	 *
	 * @param merged    number of merged results
	 * @param degraded  number of degraded results among them
	 * @param hits      number of cache hits among them
	 * @param abandoned number of abandoned tasks of the batch
	 * @return a new TranslationSummary with updated counts
	 */
	@Nonnull
	public TranslationSummary withBatch(int merged, int degraded, int hits, int abandoned) {
		return new TranslationSummary(
			this.status,
			this.totalTasks,
			this.translatedCount + merged,
			this.degradedCount + degraded,
			this.abandonedCount + abandoned,
			this.cacheHits + hits,
			this.checkpoints,
			this.lostCheckpoints,
			this.elapsedMillis
		);
	}

	/**
	 * Creates a new summary with the outcome of one checkpoint attempt recorded.
	 *
	 * @param persisted whether the checkpoint was written
	 * @return a new TranslationSummary with updated counts
	 */
	@Nonnull
	public TranslationSummary withCheckpoint(boolean persisted) {
		return new TranslationSummary(
			this.status,
			this.totalTasks,
			this.translatedCount,
			this.degradedCount,
			this.abandonedCount,
			this.cacheHits,
			persisted ? this.checkpoints + 1 : this.checkpoints,
			persisted ? this.lostCheckpoints : this.lostCheckpoints + 1,
			this.elapsedMillis
		);
	}

	/**
	 * Creates the final summary with the run status and elapsed time.
	 *
	 * @param status        how the run ended
	 * @param elapsedMillis wall time of the run
	 * @return a new TranslationSummary
	 */
	@Nonnull
	public TranslationSummary finish(@Nonnull RunStatus status, long elapsedMillis) {
		return new TranslationSummary(
			status,
			this.totalTasks,
			this.translatedCount,
			this.degradedCount,
			this.abandonedCount,
			this.cacheHits,
			this.checkpoints,
			this.lostCheckpoints,
			elapsedMillis
		);
	}

	@Override
	public String toString() {
		return String.format(
			"TranslationSummary[status=%s, translated=%d/%d, degraded=%d, abandoned=%d, cacheHits=%d, checkpoints=%d, lost=%d]",
			this.status, this.translatedCount, this.totalTasks, this.degradedCount, this.abandonedCount,
			this.cacheHits, this.checkpoints, this.lostCheckpoints
		);
	}
}
