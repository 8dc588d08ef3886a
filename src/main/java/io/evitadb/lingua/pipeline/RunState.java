package io.evitadb.lingua.pipeline;

/**
 * Lifecycle of a translation run with respect to cancellation. States only move forward.
 */
public enum RunState {

	/** Normal operation. */
	RUNNING,
	/** An interrupt was received; no new batch is dispatched from now on. */
	CANCEL_REQUESTED,
	/** Tasks already held by workers are finishing; no new task is pulled. */
	DRAINING,
	/** All workers have exited; only the final checkpoint and cache flush remain. */
	STOPPED

}
