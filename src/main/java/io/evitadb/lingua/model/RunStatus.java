package io.evitadb.lingua.model;

/**
 * Final state of a translation run.
 */
public enum RunStatus {

	/** Every extracted task was processed. */
	COMPLETED,
	/** The catalog had nothing to translate and was saved unchanged. */
	NOTHING_TO_DO,
	/** The run was interrupted; the output holds the work merged before the interruption. */
	CANCELLED

}
