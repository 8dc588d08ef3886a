package io.evitadb.lingua.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persistent store of translations already obtained from a backend, shared by all workers.
 *
 * Entries are keyed by {@link CacheFingerprint}; once a key is written its value never changes
 * within a run. All reads and writes of the in-memory map happen inside a single short critical
 * section; the file is written from a snapshot outside of it, so flushing never blocks workers for
 * longer than the copy of the map.
 *
 * The cache file is a JSON object mapping fingerprints to translations. It is flushed after every
 * `flushInterval` insertions and explicitly at the end of a run. I/O failures are logged and never
 * propagated: a broken cache must not stop a translation.
 */
public final class TranslationCache {

	private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};
	private static final String CACHE_SUFFIX = ".lingua-cache.json";

	@Nullable
	private final Path file;
	private final int flushInterval;
	@Nonnull
	private final ObjectMapper mapper;
	@Nonnull
	private final Log log;

	private final Object lock = new Object();
	private final Object flushLock = new Object();
	private final Map<String, String> entries = new HashMap<>();
	private int insertsSinceFlush;

	private final AtomicInteger hits = new AtomicInteger();
	private final AtomicInteger misses = new AtomicInteger();
	private final AtomicInteger stores = new AtomicInteger();

	private TranslationCache(
		@Nullable Path file,
		int flushInterval,
		@Nonnull ObjectMapper mapper,
		@Nonnull Log log
	) {
		this.file = file;
		this.flushInterval = flushInterval;
		this.mapper = mapper;
		this.log = log;
	}

	/**
	 * Opens the cache backed by the given file, loading its content if the file exists.
	 * An unreadable or corrupt file is reported and the cache starts empty.
	 *
	 * @param file          the cache file
	 * @param flushInterval number of insertions between automatic flushes, at least 1
	 * @param mapper        Jackson mapper used for the file format
	 * @param log           Maven log for output
	 * @return the opened cache
	 */
	@Nonnull
	public static TranslationCache open(
		@Nonnull Path file,
		int flushInterval,
		@Nonnull ObjectMapper mapper,
		@Nonnull Log log
	) {
		Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(mapper, "mapper must not be null");
		Objects.requireNonNull(log, "log must not be null");
		if (flushInterval < 1) {
			throw new IllegalArgumentException("flushInterval must be at least 1");
		}

		final TranslationCache cache = new TranslationCache(file.toAbsolutePath().normalize(), flushInterval, mapper, log);
		cache.load();
		return cache;
	}

	/**
	 * Returns a cache that never hits, never stores and never touches the disk.
	 *
	 * @param log Maven log for output
	 * @return a disabled cache
	 */
	@Nonnull
	public static TranslationCache disabled(@Nonnull Log log) {
		return new TranslationCache(null, Integer.MAX_VALUE, new ObjectMapper(), Objects.requireNonNull(log, "log must not be null"));
	}

	/**
	 * Derives the cache file of a catalog translated into the target language: a hidden sibling of
	 * the output catalog, e.g. `messages.fa.po` → `.messages.fa.po.fa.lingua-cache.json`.
	 *
	 * @param outputFile the output catalog
	 * @param targetLang target language code
	 * @return the default cache file location
	 */
	@Nonnull
	public static Path defaultLocation(@Nonnull Path outputFile, @Nonnull String targetLang) {
		final Path absolute = outputFile.toAbsolutePath().normalize();
		return absolute.resolveSibling("." + absolute.getFileName() + "." + targetLang + CACHE_SUFFIX);
	}

	public boolean isEnabled() {
		return this.file != null;
	}

	@Nullable
	public Path getFile() {
		return this.file;
	}

	/**
	 * Looks up a previous translation. Blank texts are never cached.
	 *
	 * @param text       the source text
	 * @param sourceLang source language code
	 * @param targetLang target language code
	 * @return Optional containing the cached translation
	 */
	@Nonnull
	public Optional<String> lookup(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang) {
		if (!isEnabled() || text.isBlank()) {
			return Optional.empty();
		}
		final String key = CacheFingerprint.of(text, sourceLang, targetLang);
		final String value;
		synchronized (this.lock) {
			value = this.entries.get(key);
		}
		(value == null ? this.misses : this.hits).incrementAndGet();
		return Optional.ofNullable(value);
	}

	/**
	 * Stores a translation. Storing a key that is already present keeps the first value.
	 * Every `flushInterval` insertions the calling thread flushes the cache to disk.
	 *
	 * @param text        the source text
	 * @param translation the translation obtained from the backend
	 * @param sourceLang  source language code
	 * @param targetLang  target language code
	 */
	public void store(
		@Nonnull String text,
		@Nonnull String translation,
		@Nonnull String sourceLang,
		@Nonnull String targetLang
	) {
		Objects.requireNonNull(translation, "translation must not be null");
		if (!isEnabled() || text.isBlank()) {
			return;
		}
		final String key = CacheFingerprint.of(text, sourceLang, targetLang);
		final boolean flushNow;
		synchronized (this.lock) {
			final String existing = this.entries.putIfAbsent(key, translation);
			if (existing != null) {
				if (!existing.equals(translation)) {
					this.log.debug("[CACHE] Keeping first translation of " + key);
				}
				return;
			}
			this.insertsSinceFlush++;
			flushNow = this.insertsSinceFlush >= this.flushInterval;
			if (flushNow) {
				this.insertsSinceFlush = 0;
			}
		}
		this.stores.incrementAndGet();
		if (flushNow) {
			flush();
		}
	}

	/**
	 * Writes a snapshot of the cache to its file (via a temporary file moved into place).
	 * Failures are logged, never thrown.
	 *
	 * @return true if the file was written (or the cache is disabled), false on failure
	 */
	public boolean flush() {
		if (!isEnabled()) {
			return true;
		}
		synchronized (this.flushLock) {
			// snapshots are taken in the same order as they are written, so the file never goes back in time
			final Map<String, String> snapshot;
			synchronized (this.lock) {
				snapshot = new TreeMap<>(this.entries);
			}
			final Path target = Objects.requireNonNull(this.file);
			try {
				final Path parent = target.getParent();
				if (parent != null) {
					Files.createDirectories(parent);
				}
				final Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
				this.mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
				moveIntoPlace(tmp, target);
				this.log.debug("[CACHE] Flushed " + snapshot.size() + " entries to " + target);
				return true;
			} catch (IOException | RuntimeException e) {
				this.log.warn("[CACHE] Failed to write cache file " + target + ": " + e.getMessage());
				return false;
			}
		}
	}

	public int size() {
		synchronized (this.lock) {
			return this.entries.size();
		}
	}

	public int getHits() {
		return this.hits.get();
	}

	public int getMisses() {
		return this.misses.get();
	}

	public int getStores() {
		return this.stores.get();
	}

	private void load() {
		final Path source = Objects.requireNonNull(this.file);
		if (!Files.exists(source)) {
			this.log.info("[CACHE] No cache file yet, starting empty: " + source);
			return;
		}
		try {
			final Map<String, String> loaded = this.mapper.readValue(source.toFile(), MAP_TYPE);
			synchronized (this.lock) {
				loaded.forEach((key, value) -> {
					if (key != null && value != null) {
						this.entries.put(key, value);
					}
				});
			}
			this.log.info("[CACHE] Loaded " + size() + " cached translations from " + source);
		} catch (IOException | RuntimeException e) {
			this.log.warn("[CACHE] Ignoring unreadable cache file " + source + ": " + e.getMessage());
		}
	}

	static void moveIntoPlace(@Nonnull Path tmp, @Nonnull Path target) throws IOException {
		try {
			Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}
}
