package io.evitadb.lingua.pipeline;

import io.evitadb.lingua.backend.BackendException;
import io.evitadb.lingua.backend.TranslationBackend;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Backend for pipeline tests: appends a suffix, fails on request and reports every call.
 */
class ScriptedBackend implements TranslationBackend {

	private final String suffix;
	private final AtomicInteger calls = new AtomicInteger();
	private final AtomicInteger inFlight = new AtomicInteger();
	private final AtomicInteger maxInFlight = new AtomicInteger();
	private final List<String> texts = Collections.synchronizedList(new ArrayList<>());
	private volatile boolean failing;
	private volatile IntConsumer onCall = call -> {};
	private volatile long delayMillis;

	ScriptedBackend(String suffix) {
		this.suffix = suffix;
	}

	ScriptedBackend failing() {
		this.failing = true;
		return this;
	}

	ScriptedBackend onCall(IntConsumer onCall) {
		this.onCall = onCall;
		return this;
	}

	ScriptedBackend delay(long millis) {
		this.delayMillis = millis;
		return this;
	}

	@Nonnull
	@Override
	public String translate(@Nonnull String text, @Nonnull String sourceLang, @Nonnull String targetLang) throws BackendException {
		final int call = calls.incrementAndGet();
		texts.add(text);
		final int current = inFlight.incrementAndGet();
		maxInFlight.accumulateAndGet(current, Math::max);
		try {
			onCall.accept(call);
			if (delayMillis > 0) {
				Thread.sleep(delayMillis);
			}
			if (failing) {
				throw new BackendException("backend down", null);
			}
			return text + suffix;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BackendException("interrupted", e);
		} finally {
			inFlight.decrementAndGet();
		}
	}

	@Nonnull
	@Override
	public String name() {
		return "scripted";
	}

	int getCalls() {
		return calls.get();
	}

	int getMaxInFlight() {
		return maxInFlight.get();
	}

	List<String> getTexts() {
		synchronized (texts) {
			return new ArrayList<>(texts);
		}
	}
}
