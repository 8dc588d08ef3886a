package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.TranslationTask;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of dispatching one batch to the {@link WorkerPool}. Every dispatched task appears
 * exactly once, either as a result or as abandoned because the run was cancelled.
 *
 * @param results   results in order of arrival
 * @param abandoned tasks that were never processed due to cancellation
 */
public record BatchOutcome(
	@Nonnull List<TranslationResult> results,
	@Nonnull List<TranslationTask> abandoned
) {

	public BatchOutcome {
		results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
		abandoned = List.copyOf(Objects.requireNonNull(abandoned, "abandoned must not be null"));
	}

	/**
	 * Returns the number of tasks accounted for by this outcome.
	 *
	 * @return results plus abandoned tasks
	 */
	public int size() {
		return this.results.size() + this.abandoned.size();
	}

	public boolean isComplete() {
		return this.abandoned.isEmpty();
	}
}
