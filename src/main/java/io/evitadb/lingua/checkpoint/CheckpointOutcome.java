package io.evitadb.lingua.checkpoint;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of one checkpoint attempt.
 *
 * @param kind  where the catalog ended up
 * @param path  the file that was written, null if the checkpoint was lost
 * @param cause the failure that made the checkpoint fall back or get lost, null otherwise
 */
public record CheckpointOutcome(
	@Nonnull Kind kind,
	@Nullable Path path,
	@Nullable Throwable cause
) {

	/**
	 * Where a checkpoint was persisted.
	 */
	public enum Kind {
		/** Written to a backup file only (periodic checkpoint). */
		BACKUP,
		/** Written to a backup file and promoted to the output file (final checkpoint). */
		PROMOTED,
		/** The backup could not be written; the output file was written directly instead. */
		DIRECT,
		/** Nothing could be written. */
		LOST
	}

	public CheckpointOutcome {
		Objects.requireNonNull(kind, "kind must not be null");
	}

	@Nonnull
	public static CheckpointOutcome backup(@Nonnull Path backup) {
		return new CheckpointOutcome(Kind.BACKUP, backup, null);
	}

	@Nonnull
	public static CheckpointOutcome promoted(@Nonnull Path output) {
		return new CheckpointOutcome(Kind.PROMOTED, output, null);
	}

	@Nonnull
	public static CheckpointOutcome direct(@Nonnull Path output, @Nonnull Throwable cause) {
		return new CheckpointOutcome(Kind.DIRECT, output, cause);
	}

	@Nonnull
	public static CheckpointOutcome lost(@Nonnull Throwable cause) {
		return new CheckpointOutcome(Kind.LOST, null, cause);
	}

	/**
	 * Returns true if the catalog was written somewhere.
	 *
	 * @return false only for lost checkpoints
	 */
	public boolean isPersisted() {
		return this.kind != Kind.LOST;
	}
}
