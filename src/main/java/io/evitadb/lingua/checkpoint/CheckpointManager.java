package io.evitadb.lingua.checkpoint;

import io.evitadb.lingua.model.PoCatalog;
import io.evitadb.lingua.po.CatalogIo;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Persists snapshots of a catalog being translated so that an interrupted run loses nothing that
 * was already merged.
 *
 * Every checkpoint first writes a timestamped backup next to the output file
 * (`messages_backup_20240101_120000_000.po`). Periodic checkpoints keep one rolling backup.
 * A final checkpoint additionally promotes the backup to the output file: the backup is copied to
 * a temporary file beside the output and moved over it atomically, so the output file is never
 * left half written. Older backups are then pruned, keeping only the newest.
 *
 * When the backup cannot be written, the output file is written directly (still through a
 * temporary file). When that fails as well the checkpoint is reported as lost.
 *
 * Checkpoints are serialized; the manager never writes two snapshots at once.
 */
public final class CheckpointManager implements AutoCloseable {

	private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
	private static final String BACKUP_MARKER = "_backup_";

	@Nonnull
	private final Path outputFile;
	@Nonnull
	private final CatalogIo catalogIo;
	@Nonnull
	private final Log log;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final String baseName;
	@Nonnull
	private final String extension;
	private final ExecutorService saveExecutor = Executors.newSingleThreadExecutor(runnable -> {
		final Thread thread = new Thread(runnable, "lingua-checkpoint");
		thread.setDaemon(true);
		return thread;
	});

	@Nullable
	private Path currentBackup;

	public CheckpointManager(@Nonnull Path outputFile, @Nonnull CatalogIo catalogIo, @Nonnull Log log) {
		this(outputFile, catalogIo, log, Clock.systemDefaultZone());
	}

	/**
	 * Creates a checkpoint manager for the given output file.
	 *
	 * @param outputFile the canonical output catalog
	 * @param catalogIo  writer of catalogs
	 * @param log        Maven log for output
	 * @param clock      clock used for backup timestamps
	 */
	public CheckpointManager(
		@Nonnull Path outputFile,
		@Nonnull CatalogIo catalogIo,
		@Nonnull Log log,
		@Nonnull Clock clock
	) {
		this.outputFile = Objects.requireNonNull(outputFile, "outputFile must not be null").toAbsolutePath().normalize();
		this.catalogIo = Objects.requireNonNull(catalogIo, "catalogIo must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");

		final String fileName = this.outputFile.getFileName().toString();
		final int dot = fileName.lastIndexOf('.');
		this.baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
		this.extension = dot > 0 ? fileName.substring(dot) : "";
	}

	@Nonnull
	public Path getOutputFile() {
		return this.outputFile;
	}

	/**
	 * Writes a checkpoint of the catalog. The caller must not modify the catalog until the method returns.
	 *
	 * @param catalog the catalog to persist
	 * @param isFinal whether to promote the checkpoint to the output file and prune old backups
	 * @return where the checkpoint was written, or a lost outcome
	 */
	@Nonnull
	public synchronized CheckpointOutcome checkpoint(@Nonnull PoCatalog catalog, boolean isFinal) {
		Objects.requireNonNull(catalog, "catalog must not be null");

		final Path backup = nextBackupPath();
		try {
			this.catalogIo.save(catalog, backup);
		} catch (IOException | RuntimeException e) {
			this.log.warn("[CHECKPOINT] Failed to write backup " + backup.getFileName() + ": " + e.getMessage() +
				". Writing " + this.outputFile.getFileName() + " directly.");
			return writeDirectly(catalog, e);
		}

		final Path previous = this.currentBackup;
		this.currentBackup = backup;
		if (!isFinal) {
			if (previous != null && !previous.equals(backup)) {
				deleteQuietly(previous);
			}
			this.log.info("[CHECKPOINT] Progress saved to " + backup.getFileName());
			return CheckpointOutcome.backup(backup);
		}

		try {
			promote(backup);
		} catch (IOException | RuntimeException e) {
			this.log.warn("[CHECKPOINT] Failed to promote " + backup.getFileName() + ": " + e.getMessage() +
				". Writing " + this.outputFile.getFileName() + " directly.");
			return writeDirectly(catalog, e);
		}
		pruneBackups(backup);
		this.log.info("[CHECKPOINT] Catalog saved to " + this.outputFile + " (backup " + backup.getFileName() + ")");
		return CheckpointOutcome.promoted(this.outputFile);
	}

	/**
	 * Writes a checkpoint on the manager's own thread. The snapshot must not be shared with code
	 * that keeps modifying it. Once started the write runs to completion; callers may stop waiting
	 * for the returned future but the write still finishes in the background.
	 *
	 * @param snapshot the catalog snapshot to persist
	 * @param isFinal  whether to promote the checkpoint to the output file
	 * @return future completed with the checkpoint outcome
	 */
	@Nonnull
	public CompletableFuture<CheckpointOutcome> checkpointAsync(@Nonnull PoCatalog snapshot, boolean isFinal) {
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		return CompletableFuture.supplyAsync(() -> checkpoint(snapshot, isFinal), this.saveExecutor);
	}

	/**
	 * Lists the backups of the output file, newest first.
	 *
	 * @return backup files
	 * @throws IOException if the directory cannot be listed
	 */
	@Nonnull
	public List<Path> listBackups() throws IOException {
		final Path directory = this.outputFile.getParent();
		if (directory == null || !Files.isDirectory(directory)) {
			return List.of();
		}
		final String prefix = this.baseName + BACKUP_MARKER;
		try (Stream<Path> files = Files.list(directory)) {
			return files
				.filter(file -> {
					final String name = file.getFileName().toString();
					return name.startsWith(prefix) && name.endsWith(this.extension);
				})
				.sorted(Comparator.comparing((Path file) -> file.getFileName().toString()).reversed())
				.collect(Collectors.toList());
		}
	}

	/**
	 * Stops the background save thread after pending saves are done.
	 */
	@Override
	public void close() {
		this.saveExecutor.shutdown();
	}

	@Nonnull
	private Path nextBackupPath() {
		final String timestamp = LocalDateTime.now(this.clock).format(BACKUP_TIMESTAMP);
		return this.outputFile.resolveSibling(this.baseName + BACKUP_MARKER + timestamp + this.extension);
	}

	private void promote(@Nonnull Path backup) throws IOException {
		final Path tmp = temporaryOutput();
		Files.copy(backup, tmp, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
		moveIntoPlace(tmp, this.outputFile);
	}

	@Nonnull
	private CheckpointOutcome writeDirectly(@Nonnull PoCatalog catalog, @Nonnull Throwable backupFailure) {
		final Path tmp = temporaryOutput();
		try {
			this.catalogIo.save(catalog, tmp);
			moveIntoPlace(tmp, this.outputFile);
			this.log.info("[CHECKPOINT] Saved directly to " + this.outputFile);
			return CheckpointOutcome.direct(this.outputFile, backupFailure);
		} catch (IOException | RuntimeException e) {
			e.addSuppressed(backupFailure);
			deleteQuietly(tmp);
			this.log.error("[CHECKPOINT] Failed to save progress: " + e.getMessage(), e);
			return CheckpointOutcome.lost(e);
		}
	}

	private void pruneBackups(@Nonnull Path keep) {
		try {
			for (final Path backup : listBackups()) {
				if (!backup.equals(keep)) {
					deleteQuietly(backup);
				}
			}
		} catch (IOException e) {
			this.log.warn("[CHECKPOINT] Failed to list old backups: " + e.getMessage());
		}
	}

	private void deleteQuietly(@Nonnull Path file) {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			this.log.warn("[CHECKPOINT] Failed to delete " + file.getFileName() + ": " + e.getMessage());
		}
	}

	@Nonnull
	private Path temporaryOutput() {
		return this.outputFile.resolveSibling("." + this.outputFile.getFileName() + ".tmp");
	}

	private static void moveIntoPlace(@Nonnull Path source, @Nonnull Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
