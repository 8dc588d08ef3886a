package io.evitadb.lingua.pipeline;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal of one translation run.
 *
 * The token is created per run and passed explicitly to every component that has to observe it.
 * Cancellation is monotonic: once requested it cannot be withdrawn, and the {@link RunState}
 * only ever advances. A run that finishes without interruption goes from
 * {@link RunState#RUNNING} straight to {@link RunState#STOPPED}.
 */
public final class CancellationToken {

	private final AtomicReference<RunState> state = new AtomicReference<>(RunState.RUNNING);
	private final AtomicBoolean cancelled = new AtomicBoolean();

	/**
	 * Requests cancellation. Calling it again, or after the run already stopped, has no effect.
	 *
	 * @return true if this call performed the transition from {@link RunState#RUNNING}
	 */
	public boolean cancel() {
		if (this.state.compareAndSet(RunState.RUNNING, RunState.CANCEL_REQUESTED)) {
			this.cancelled.set(true);
			return true;
		}
		return false;
	}

	/**
	 * Returns true once cancellation has been requested.
	 *
	 * @return true if the run must stop taking on new work
	 */
	public boolean isCancelled() {
		return this.cancelled.get() || this.state.get() == RunState.CANCEL_REQUESTED;
	}

	@Nonnull
	public RunState getState() {
		return this.state.get();
	}

	/**
	 * Advances the state to the given one if it lies ahead of the current state.
	 *
	 * @param target the state to advance to
	 * @return true if the state changed
	 */
	public boolean advanceTo(@Nonnull RunState target) {
		Objects.requireNonNull(target, "target must not be null");
		while (true) {
			final RunState current = this.state.get();
			if (current.ordinal() >= target.ordinal()) {
				return false;
			}
			if (this.state.compareAndSet(current, target)) {
				return true;
			}
		}
	}

	@Override
	public String toString() {
		return "CancellationToken[" + this.state.get() + (this.cancelled.get() ? ", cancelled" : "") + "]";
	}
}
