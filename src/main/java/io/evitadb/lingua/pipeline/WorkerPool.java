package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.backend.BackendException;
import io.evitadb.lingua.backend.TranslationBackend;
import io.evitadb.lingua.cache.TranslationCache;
import io.evitadb.lingua.model.TranslationResult;
import io.evitadb.lingua.model.TranslationTask;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers translating tasks in parallel.
 *
 * Workers are long-running loops that pull tasks from a shared queue with a short timeout, so that
 * cancellation and {@link #close()} are noticed promptly. For each task a worker consults the
 * {@link TranslationCache}, calls the {@link TranslationBackend} on a miss and publishes the result.
 * Only successful translations are cached; failures yield a degraded result carrying the source
 * text. A failure of one task, including an {@link Error} raised by the backend, never stops a worker.
 *
 * Batches are handed over with {@link #dispatch(List)}, which blocks until every task of the batch
 * has a result or was abandoned because of cancellation. Tasks are consumed from the queue, so a
 * task is processed by at most one worker.
 */
public final class WorkerPool implements AutoCloseable {

	public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(200);
	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	@Nonnull
	private final TranslationBackend backend;
	@Nonnull
	private final TranslationCache cache;
	@Nonnull
	private final String sourceLang;
	@Nonnull
	private final String targetLang;
	@Nonnull
	private final CancellationToken token;
	private final long requestDelayMillis;
	private final long pollTimeoutMillis;
	@Nonnull
	private final Log log;

	private final ExecutorService executor;
	private final BlockingQueue<TranslationTask> queue = new LinkedBlockingQueue<>();
	private final AtomicInteger activeWorkers = new AtomicInteger();
	private volatile BatchCollector collector = new BatchCollector(0);
	private volatile boolean closed;

	/**
	 * Creates the pool and starts its workers.
	 *
	 * @param parallelism  number of workers, at least 1
	 * @param backend      the backend called on cache misses
	 * @param cache        the cache shared by all workers
	 * @param sourceLang   source language code
	 * @param targetLang   target language code
	 * @param token        cancellation token of the run
	 * @param requestDelay pause of a worker after each backend call
	 * @param pollTimeout  how long a worker waits for a task before re-checking cancellation
	 * @param log          Maven log for output
	 */
	public WorkerPool(
		int parallelism,
		@Nonnull TranslationBackend backend,
		@Nonnull TranslationCache cache,
		@Nonnull String sourceLang,
		@Nonnull String targetLang,
		@Nonnull CancellationToken token,
		@Nonnull Duration requestDelay,
		@Nonnull Duration pollTimeout,
		@Nonnull Log log
	) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.cache = Objects.requireNonNull(cache, "cache must not be null");
		this.sourceLang = Objects.requireNonNull(sourceLang, "sourceLang must not be null");
		this.targetLang = Objects.requireNonNull(targetLang, "targetLang must not be null");
		this.token = Objects.requireNonNull(token, "token must not be null");
		this.requestDelayMillis = Objects.requireNonNull(requestDelay, "requestDelay must not be null").toMillis();
		this.pollTimeoutMillis = Math.max(1, Objects.requireNonNull(pollTimeout, "pollTimeout must not be null").toMillis());
		this.log = Objects.requireNonNull(log, "log must not be null");
		if (this.requestDelayMillis < 0) {
			throw new IllegalArgumentException("requestDelay must not be negative");
		}

		this.executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
		this.activeWorkers.set(parallelism);
		for (int i = 0; i < parallelism; i++) {
			this.executor.execute(this::runWorker);
		}
	}

	/**
	 * Processes one batch and blocks until every task has a result or has been abandoned.
	 *
	 * On cancellation, tasks still waiting in the queue are abandoned while tasks already held by
	 * a worker run to completion (a backend call in progress is not interrupted).
	 *
	 * @param batch the tasks to process
	 * @return results and abandoned tasks of the batch
	 * @throws IllegalStateException if the pool has been closed or all of its workers have exited
	 * @throws InterruptedException  if the calling thread is interrupted while waiting
	 */
	@Nonnull
	public BatchOutcome dispatch(@Nonnull List<TranslationTask> batch) throws InterruptedException {
		Objects.requireNonNull(batch, "batch must not be null");
		if (this.closed) {
			throw new IllegalStateException("Worker pool is closed");
		}

		final BatchCollector current = new BatchCollector(batch.size());
		this.collector = current;
		if (this.token.isCancelled()) {
			batch.forEach(current::abandon);
			return current.toOutcome();
		}
		if (this.activeWorkers.get() == 0) {
			throw new IllegalStateException("All workers exited, cannot dispatch " + batch.size() + " tasks");
		}
		this.queue.addAll(batch);

		while (!current.await(this.pollTimeoutMillis)) {
			if (this.token.isCancelled()) {
				this.token.advanceTo(RunState.DRAINING);
				abandonQueued(current);
			}
			if (this.activeWorkers.get() == 0 && !current.await(0)) {
				// no worker left to pick up what is still queued
				this.queue.clear();
				throw new IllegalStateException(
					"All workers exited with " + current.remaining() + " tasks unaccounted for"
				);
			}
		}
		return current.toOutcome();
	}

	/**
	 * Returns the number of workers that have not exited yet.
	 *
	 * @return live worker count
	 */
	public int getActiveWorkers() {
		return this.activeWorkers.get();
	}

	/**
	 * Signals the workers to exit and waits for them to finish their current task.
	 */
	@Override
	public void close() {
		this.closed = true;
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("[WORKER] Workers did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}

	private void abandonQueued(@Nonnull BatchCollector current) {
		final List<TranslationTask> leftovers = new ArrayList<>();
		this.queue.drainTo(leftovers);
		if (!leftovers.isEmpty()) {
			this.log.info("[CANCEL] Abandoning " + leftovers.size() + " queued tasks");
			leftovers.forEach(current::abandon);
		}
	}

	private void runWorker() {
		try {
			while (!this.closed && !this.token.isCancelled()) {
				final TranslationTask task = this.queue.poll(this.pollTimeoutMillis, TimeUnit.MILLISECONDS);
				if (task == null) {
					continue;
				}
				final BatchCollector current = this.collector;
				if (this.token.isCancelled()) {
					current.abandon(task);
					break;
				}

				final Optional<TranslationResult> cached = lookupCached(task);
				if (cached.isPresent()) {
					current.complete(cached.get());
				} else {
					current.complete(translate(task));
					if (this.requestDelayMillis > 0) {
						Thread.sleep(this.requestDelayMillis);
					}
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			this.activeWorkers.decrementAndGet();
		}
	}

	@Nonnull
	private Optional<TranslationResult> lookupCached(@Nonnull TranslationTask task) {
		final String text = task.sourceText();
		if (text.isBlank()) {
			// blank texts are returned as they are
			return Optional.of(new TranslationResult(task.key(), text, false, false));
		}
		try {
			return this.cache.lookup(text, this.sourceLang, this.targetLang)
				.map(translation -> TranslationResult.cached(task, translation));
		} catch (RuntimeException | Error e) {
			this.log.warn("[CACHE] Lookup failed for " + task.key() + ": " + e.getMessage());
			return Optional.empty();
		}
	}

	@Nonnull
	private TranslationResult translate(@Nonnull TranslationTask task) {
		try {
			final String translation = this.backend.translate(task.sourceText(), this.sourceLang, this.targetLang);
			if (translation.isBlank()) {
				this.log.warn("[WORKER] Backend " + this.backend.name() + " returned an empty translation for " + task.key());
				return TranslationResult.degraded(task);
			}
			this.cache.store(task.sourceText(), translation, this.sourceLang, this.targetLang);
			return TranslationResult.translated(task, translation);
		} catch (BackendException e) {
			this.log.warn("[WORKER] Backend " + this.backend.name() + " failed for " + task.key() +
				(e.isPermanent() ? " (permanent)" : "") + ": " + e.getMessage());
			return TranslationResult.degraded(task);
		} catch (RuntimeException | Error e) {
			this.log.error("[WORKER] Unexpected error while translating " + task.key() + ": " + e, e);
			return TranslationResult.degraded(task);
		}
	}

	/**
	 * Collects the results of the batch currently being processed.
	 */
	private static final class BatchCollector {
		private final List<TranslationResult> results = Collections.synchronizedList(new ArrayList<>());
		private final List<TranslationTask> abandoned = Collections.synchronizedList(new ArrayList<>());
		private final CountDownLatch remaining;

		BatchCollector(int size) {
			this.remaining = new CountDownLatch(size);
		}

		void complete(@Nonnull TranslationResult result) {
			this.results.add(result);
			this.remaining.countDown();
		}

		void abandon(@Nonnull TranslationTask task) {
			this.abandoned.add(task);
			this.remaining.countDown();
		}

		boolean await(long timeoutMillis) throws InterruptedException {
			return this.remaining.await(timeoutMillis, TimeUnit.MILLISECONDS);
		}

		long remaining() {
			return this.remaining.getCount();
		}

		@Nonnull
		BatchOutcome toOutcome() {
			synchronized (this.results) {
				synchronized (this.abandoned) {
					return new BatchOutcome(this.results, this.abandoned);
				}
			}
		}
	}

	/**
	 * Names worker threads and makes them daemons so that a stuck backend call cannot keep the JVM alive.
	 */
	private static final class WorkerThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(@Nonnull Runnable runnable) {
			final Thread thread = new Thread(runnable, "lingua-worker-" + this.counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
