package io.evitadb.lingua.backend;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown when a translation backend cannot translate a single text.
 * The pipeline treats it as a per-task failure and keeps the source text.
 */
public final class BackendException extends Exception {

	private final boolean permanent;

	/**
	 * Creates a new BackendException for a transient failure.
	 *
	 * @param message the error message
	 * @param cause   the underlying cause, may be null
	 */
	public BackendException(@Nonnull String message, @Nullable Throwable cause) {
		this(message, cause, false);
	}

	/**
	 * Creates a new BackendException.
	 *
	 * @param message   the error message
	 * @param cause     the underlying cause, may be null
	 * @param permanent whether retrying the backend within this run is pointless
	 *                  (authentication failure, exhausted quota)
	 */
	public BackendException(@Nonnull String message, @Nullable Throwable cause, boolean permanent) {
		super(message, cause);
		this.permanent = permanent;
	}

	/**
	 * Returns true if the backend reported a failure that will affect every further call.
	 *
	 * @return true for permanent failures
	 */
	public boolean isPermanent() {
		return this.permanent;
	}
}
