package io.evitadb.lingua.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.lingua.RecordingLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationCache stores translations across runs")
class TranslationCacheTest {

	@TempDir
	Path tempDir;

	private Path cacheFile;
	private ObjectMapper mapper;
	private RecordingLog log;

	@BeforeEach
	void setUp() {
		cacheFile = tempDir.resolve(".messages.fa.po.fa.lingua-cache.json");
		mapper = new ObjectMapper();
		log = new RecordingLog();
	}

	@Test
	@DisplayName("returns stored translation")
	void shouldReturnStoredTranslation() {
		final TranslationCache cache = TranslationCache.open(cacheFile, 100, mapper, log);

		assertEquals(Optional.empty(), cache.lookup("Hello", "en", "fa"));
		cache.store("Hello", "Salam", "en", "fa");

		assertEquals(Optional.of("Salam"), cache.lookup("Hello", "en", "fa"));
		assertEquals(Optional.empty(), cache.lookup("Hello", "en", "de"));
		assertEquals(1, cache.getHits());
		assertEquals(2, cache.getMisses());
	}

	@Test
	@DisplayName("keeps the first value of a key")
	void shouldKeepFirstValue() {
		final TranslationCache cache = TranslationCache.open(cacheFile, 100, mapper, log);

		cache.store("Hello", "Salam", "en", "fa");
		cache.store("Hello", "Dorood", "en", "fa");

		assertEquals(Optional.of("Salam"), cache.lookup("Hello", "en", "fa"));
		assertEquals(1, cache.size());
		assertEquals(1, cache.getStores());
	}

	@Test
	@DisplayName("never caches blank text")
	void shouldIgnoreBlankText() {
		final TranslationCache cache = TranslationCache.open(cacheFile, 100, mapper, log);

		cache.store("  ", "x", "en", "fa");

		assertEquals(0, cache.size());
		assertEquals(Optional.empty(), cache.lookup("  ", "en", "fa"));
	}

	@Test
	@DisplayName("flushes after the configured number of insertions")
	void shouldAutoFlush() throws Exception {
		final TranslationCache cache = TranslationCache.open(cacheFile, 2, mapper, log);

		cache.store("One", "1", "en", "fa");
		assertFalse(Files.exists(cacheFile));

		cache.store("Two", "2", "en", "fa");
		assertTrue(Files.exists(cacheFile));
		final Map<String, String> onDisk = mapper.readValue(cacheFile.toFile(), new TypeReference<Map<String, String>>() {});
		assertEquals(2, onDisk.size());
		assertEquals("1", onDisk.get(CacheFingerprint.of("One", "en", "fa")));
	}

	@Test
	@DisplayName("reloads flushed entries in a new run")
	void shouldReloadFlushedEntries() {
		final TranslationCache first = TranslationCache.open(cacheFile, 100, mapper, log);
		first.store("Hello", "Salam", "en", "fa");
		assertTrue(first.flush());

		final TranslationCache second = TranslationCache.open(cacheFile, 100, mapper, log);

		assertEquals(Optional.of("Salam"), second.lookup("Hello", "en", "fa"));
		assertTrue(log.hasInfo("Loaded 1 cached translations"));
	}

	@Test
	@DisplayName("starts empty when the file is corrupt")
	void shouldIgnoreCorruptFile() throws Exception {
		Files.writeString(cacheFile, "{ not json");

		final TranslationCache cache = TranslationCache.open(cacheFile, 100, mapper, log);

		assertEquals(0, cache.size());
		assertTrue(log.hasWarning("[CACHE] Ignoring unreadable cache file"));
		cache.store("Hello", "Salam", "en", "fa");
		assertTrue(cache.flush());
	}

	@Test
	@DisplayName("reports failed flush without throwing")
	void shouldReportFailedFlush() throws Exception {
		final Path blocker = tempDir.resolve("blocker");
		Files.writeString(blocker, "a file, not a directory");
		final TranslationCache cache = TranslationCache.open(blocker.resolve("cache.json"), 100, mapper, log);
		cache.store("Hello", "Salam", "en", "fa");

		assertFalse(cache.flush());
		assertTrue(log.hasWarning("[CACHE] Failed to write cache file"));
		assertEquals(Optional.of("Salam"), cache.lookup("Hello", "en", "fa"));
	}

	@Test
	@DisplayName("disabled cache never hits and never writes")
	void shouldDoNothingWhenDisabled() {
		final TranslationCache cache = TranslationCache.disabled(log);

		cache.store("Hello", "Salam", "en", "fa");

		assertFalse(cache.isEnabled());
		assertNull(cache.getFile());
		assertEquals(Optional.empty(), cache.lookup("Hello", "en", "fa"));
		assertTrue(cache.flush());
	}

	@Test
	@DisplayName("concurrent stores of the same key keep exactly one value")
	void shouldHandleConcurrentStores() throws Exception {
		final TranslationCache cache = TranslationCache.open(cacheFile, 7, mapper, log);
		final ExecutorService pool = Executors.newFixedThreadPool(8);
		final CountDownLatch start = new CountDownLatch(1);
		final List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < 8; t++) {
				final int thread = t;
				futures.add(pool.submit(() -> {
					start.await();
					for (int i = 0; i < 50; i++) {
						cache.store("text-" + i, "value-" + thread, "en", "fa");
					}
					return null;
				}));
			}
			start.countDown();
			for (final Future<?> future : futures) {
				future.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		assertEquals(50, cache.size());
		assertEquals(50, cache.getStores());
		assertTrue(cache.flush());
		final Map<String, String> onDisk = mapper.readValue(cacheFile.toFile(), new TypeReference<Map<String, String>>() {});
		assertEquals(50, onDisk.size());
		for (int i = 0; i < 50; i++) {
			assertEquals(cache.lookup("text-" + i, "en", "fa").orElseThrow(), onDisk.get(CacheFingerprint.of("text-" + i, "en", "fa")));
		}
	}

	@Test
	@DisplayName("concurrent automatic flushes leave the newest snapshot on disk")
	void shouldWriteNewestSnapshotOnConcurrentFlushes() throws Exception {
		final TranslationCache cache = TranslationCache.open(cacheFile, 1, mapper, log);
		final ExecutorService pool = Executors.newFixedThreadPool(8);
		final CountDownLatch start = new CountDownLatch(1);
		final List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < 8; t++) {
				final int thread = t;
				futures.add(pool.submit(() -> {
					start.await();
					for (int i = 0; i < 25; i++) {
						cache.store("text-" + thread + "-" + i, "value", "en", "fa");
					}
					return null;
				}));
			}
			start.countDown();
			for (final Future<?> future : futures) {
				future.get(30, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		// no explicit flush: the last automatic flush must carry every entry
		final Map<String, String> onDisk = mapper.readValue(cacheFile.toFile(), new TypeReference<Map<String, String>>() {});
		assertEquals(200, onDisk.size());
	}

	@Test
	@DisplayName("default location is a hidden sibling of the output")
	void shouldDeriveDefaultLocation() {
		final Path location = TranslationCache.defaultLocation(tempDir.resolve("messages.fa.po"), "fa");

		assertEquals(tempDir.toAbsolutePath().normalize(), location.getParent());
		assertEquals(".messages.fa.po.fa.lingua-cache.json", location.getFileName().toString());
	}
}
