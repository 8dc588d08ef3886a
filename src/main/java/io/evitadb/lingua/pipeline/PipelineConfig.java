package io.evitadb.lingua.pipeline;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a translation run.
 *
 * @param batchSize          number of tasks dispatched to the workers at once
 * @param parallelism        number of concurrent workers
 * @param checkpointInterval number of merged translations between periodic checkpoints
 * @param retranslate        whether already translated fields are translated again
 * @param requestDelay       pause of each worker after a backend call
 * @param pollTimeout        how long idle workers wait for a task before re-checking cancellation
 * @param finalSaveTimeout   how long the run waits for its final checkpoint before leaving it to the background
 */
public record PipelineConfig(
	int batchSize,
	int parallelism,
	int checkpointInterval,
	boolean retranslate,
	@Nonnull Duration requestDelay,
	@Nonnull Duration pollTimeout,
	@Nonnull Duration finalSaveTimeout
) {

	public static final int DEFAULT_BATCH_SIZE = 10;
	public static final int DEFAULT_PARALLELISM = 4;
	public static final int DEFAULT_CHECKPOINT_INTERVAL = 50;
	public static final Duration DEFAULT_REQUEST_DELAY = Duration.ofMillis(500);
	public static final Duration DEFAULT_FINAL_SAVE_TIMEOUT = Duration.ofSeconds(30);

	public PipelineConfig {
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be at least 1");
		}
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		if (checkpointInterval < 1) {
			throw new IllegalArgumentException("checkpointInterval must be at least 1");
		}
		Objects.requireNonNull(requestDelay, "requestDelay must not be null");
		Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
		Objects.requireNonNull(finalSaveTimeout, "finalSaveTimeout must not be null");
		if (requestDelay.isNegative() || pollTimeout.isNegative() || pollTimeout.isZero() || finalSaveTimeout.isNegative()) {
			throw new IllegalArgumentException("durations must be positive");
		}
	}

	/**
	 * Returns the default configuration: batches of 10, 4 workers, a checkpoint every 50 translations
	 * and only untranslated fields are translated.
	 *
	 * @return default configuration
	 */
	@Nonnull
	public static PipelineConfig defaults() {
		return new PipelineConfig(
			DEFAULT_BATCH_SIZE,
			DEFAULT_PARALLELISM,
			DEFAULT_CHECKPOINT_INTERVAL,
			false,
			DEFAULT_REQUEST_DELAY,
			WorkerPool.DEFAULT_POLL_TIMEOUT,
			DEFAULT_FINAL_SAVE_TIMEOUT
		);
	}

	@Nonnull
	public PipelineConfig withBatchSize(int batchSize) {
		return new PipelineConfig(batchSize, this.parallelism, this.checkpointInterval, this.retranslate,
			this.requestDelay, this.pollTimeout, this.finalSaveTimeout);
	}

	@Nonnull
	public PipelineConfig withParallelism(int parallelism) {
		return new PipelineConfig(this.batchSize, parallelism, this.checkpointInterval, this.retranslate,
			this.requestDelay, this.pollTimeout, this.finalSaveTimeout);
	}

	@Nonnull
	public PipelineConfig withCheckpointInterval(int checkpointInterval) {
		return new PipelineConfig(this.batchSize, this.parallelism, checkpointInterval, this.retranslate,
			this.requestDelay, this.pollTimeout, this.finalSaveTimeout);
	}

	@Nonnull
	public PipelineConfig withRetranslate(boolean retranslate) {
		return new PipelineConfig(this.batchSize, this.parallelism, this.checkpointInterval, retranslate,
			this.requestDelay, this.pollTimeout, this.finalSaveTimeout);
	}

	@Nonnull
	public PipelineConfig withRequestDelay(@Nonnull Duration requestDelay) {
		return new PipelineConfig(this.batchSize, this.parallelism, this.checkpointInterval, this.retranslate,
			requestDelay, this.pollTimeout, this.finalSaveTimeout);
	}

	@Nonnull
	public PipelineConfig withFinalSaveTimeout(@Nonnull Duration finalSaveTimeout) {
		return new PipelineConfig(this.batchSize, this.parallelism, this.checkpointInterval, this.retranslate,
			this.requestDelay, this.pollTimeout, finalSaveTimeout);
	}
}
