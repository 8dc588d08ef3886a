package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.model.TranslationSummary;

import javax.annotation.Nonnull;

/**
 * Thrown when a translation run fails unexpectedly. By the time it is thrown the pipeline has
 * already attempted a final checkpoint of everything merged before the failure.
 */
public final class PipelineException extends RuntimeException {

	@Nonnull
	private final TranslationSummary summary;

	public PipelineException(@Nonnull String message, @Nonnull Throwable cause, @Nonnull TranslationSummary summary) {
		super(message, cause);
		this.summary = summary;
	}

	/**
	 * Returns the statistics of the run up to the failure, including the final checkpoint attempt.
	 *
	 * @return partial run summary
	 */
	@Nonnull
	public TranslationSummary getSummary() {
		return this.summary;
	}
}
