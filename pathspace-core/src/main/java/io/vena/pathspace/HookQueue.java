package io.vena.pathspace;

import io.vena.pathspace.SpaceDiagnosticContext.DiagnosticScope;
import io.vena.pathspace.glob.GlobMatcher;
import io.vena.pathspace.wait.WaitMap;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registered {@link SpaceHook}s and the queue of pending calls to them.
 *
 * <p>
 * Hooks are matched against changed paths with the same two-way glob rules as {@link WaitMap}.
 */
@RequiredArgsConstructor
final class HookQueue {
	private final SpaceDiagnosticContext diagnosticContext;
	private final List<Registration> registrations = new CopyOnWriteArrayList<>();
	private final Deque<Runnable> hookExecutionQueue = new ConcurrentLinkedDeque<>();
	private final Semaphore hookExecutionPermit = new Semaphore(1);

	Subscription register(String name, String key, Capabilities capabilities, SpaceHook hook) {
		Registration reg = new Registration(name, key, capabilities, hook);
		registrations.add(reg);
		LOGGER.debug("Registered hook {} on {}", name, key);
		return reg;
	}

	int size() {
		return registrations.size();
	}

	void clear() {
		registrations.clear();
		hookExecutionQueue.clear();
	}

	/**
	 * Queues a call to every hook that matches <code>changedPath</code> and may read it, then runs
	 * whatever is queued unless another thread is already doing so.
	 */
	void trigger(Path changedPath) {
		if (registrations.isEmpty()) {
			return;
		}
		String pathString = changedPath.toString();
		Map<String, String> attributes = diagnosticContext.getAttributes();
		for (Registration reg: registrations) {
			if (reg.active && reg.matches(pathString) && reg.capabilities.permits(changedPath, Permission.READ)) {
				LOGGER.debug("Hook: queue {}({})", reg.name, changedPath);
				hookExecutionQueue.addLast(() -> {
					if (!reg.active) {
						LOGGER.debug("Hook: skip closed {}({})", reg.name, changedPath);
						return;
					}
					// Two nested try statements so the "finally" clause runs within the diagnostic scope
					try (@SuppressWarnings("unused") DiagnosticScope foo = diagnosticContext.withOnly(attributes)) {
						try {
							LOGGER.debug("Hook: RUN {}({})", reg.name, changedPath);
							reg.hook.onChanged(changedPath);
						} finally {
							LOGGER.debug("Hook: end {}({})", reg.name, changedPath);
						}
					}
				});
			}
		}
		drainQueueIfAllowed();
	}

	/**
	 * Runs queued hooks in a "breadth-first" fashion: all hooks triggered by
	 * a hook "G" run before any hooks triggered by those.
	 *
	 * <p>
	 * The semaphore distinguishes the outermost call from calls made by hooks themselves
	 * (which insert, and so trigger), and only the outermost call dequeues.
	 * This also means at most one thread runs hooks at a time.
	 *
	 * <p>
	 * Don't call while holding a node lock: hooks are arbitrary user code.
	 */
	private void drainQueueIfAllowed() {
		do {
			if (hookExecutionPermit.tryAcquire()) {
				try {
					for (Runnable ex = hookExecutionQueue.pollFirst(); ex != null; ex = hookExecutionQueue.pollFirst()) {
						try {
							ex.run();
						} catch (Exception e) {
							LOGGER.error("Hook aborted due to exception: {}", e.getMessage(), e);
						}
					}
				} finally {
					hookExecutionPermit.release();
				}
			} else {
				LOGGER.debug("Not draining the hook queue");
				return;
			}

			// Another thread may have queued a hook after we drained but before we released
			// the permit, and then failed to acquire it. Check again so that hook isn't stranded.
		} while (!hookExecutionQueue.isEmpty());
	}

	@Getter
	@Accessors(fluent = true)
	@RequiredArgsConstructor
	private final class Registration implements Subscription {
		private final String name;
		private final String key;
		@Getter(lombok.AccessLevel.NONE) private final Capabilities capabilities;
		@Getter(lombok.AccessLevel.NONE) private final SpaceHook hook;
		@Getter(lombok.AccessLevel.NONE) private volatile boolean active = true;

		boolean matches(String changedPath) {
			return GlobMatcher.matchEitherWay(key, changedPath);
		}

		@Override
		public void close() {
			if (active) {
				active = false;
				registrations.remove(this);
				LOGGER.debug("Unregistered hook {} on {}", name, key);
			}
		}

		@Override
		public String toString() {
			return "Subscription(" + name + " on " + key + ")";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HookQueue.class);
}
