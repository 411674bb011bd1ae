package io.vena.pathspace.wait;

import io.vena.pathspace.glob.GlobMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of blocking waits keyed by path strings, which may be globs.
 *
 * <p>
 * {@link #notify(String)} wakes every entry whose key matches the notified key
 * in either direction: a concrete notification wakes glob waiters whose pattern matches it,
 * and a glob notification wakes waiters whose key it matches.
 *
 * <p>
 * Notifiers never block on waiters. Each entry keeps a signal counter that waiters
 * re-check before parking, and notifiers only bump that counter and unpark
 * the threads parked on the entry, so no wakeup is lost between a waiter's
 * predicate check and its park.
 */
public final class WaitMap {
	private final ReentrantLock registryLock = new ReentrantLock();
	private final Map<String, Entry> entries = new HashMap<>();

	/**
	 * Registers a waiter on <code>key</code>, creating its entry if necessary.
	 * Close the returned guard to unregister; the entry disappears with its last guard.
	 */
	public Guard waitFor(String key) {
		registryLock.lock();
		try {
			Entry entry = entries.computeIfAbsent(key, Entry::new);
			entry.guards++;
			return new Guard(entry);
		} finally {
			registryLock.unlock();
		}
	}

	/**
	 * Wakes every waiter whose key matches <code>key</code> in either direction.
	 */
	public void notify(String key) {
		List<Entry> matching = new ArrayList<>();
		registryLock.lock();
		try {
			for (Entry entry: entries.values()) {
				if (GlobMatcher.matchEitherWay(entry.key, key)) {
					matching.add(entry);
				}
			}
		} finally {
			registryLock.unlock();
		}
		LOGGER.trace("Notify {} wakes {} entries", key, matching.size());
		matching.forEach(Entry::signal);
	}

	/**
	 * Wakes every waiter regardless of key.
	 */
	public void notifyAllWaiters() {
		List<Entry> all;
		registryLock.lock();
		try {
			all = new ArrayList<>(entries.values());
		} finally {
			registryLock.unlock();
		}
		LOGGER.debug("Notify all {} entries", all.size());
		all.forEach(Entry::signal);
	}

	/**
	 * Drops every entry. Guards still holding a dropped entry are not woken by later
	 * notifications; call {@link #notifyAllWaiters()} first if they must not hang.
	 */
	public void clear() {
		registryLock.lock();
		try {
			LOGGER.debug("Clearing {} entries", entries.size());
			entries.clear();
		} finally {
			registryLock.unlock();
		}
	}

	public boolean hasWaiters() {
		registryLock.lock();
		try {
			return entries.values().stream().anyMatch(e -> e.guards > 0);
		} finally {
			registryLock.unlock();
		}
	}

	@RequiredArgsConstructor
	private static final class Entry {
		final String key;
		final AtomicLong signals = new AtomicLong();
		final Set<Thread> parked = ConcurrentHashMap.newKeySet();

		/**
		 * Guarded by {@link WaitMap#registryLock}.
		 */
		int guards = 0;

		void signal() {
			signals.incrementAndGet();
			parked.forEach(LockSupport::unpark);
		}
	}

	/**
	 * A registration on one {@link WaitMap} entry.
	 * Meant to be used in a try-with-resources block by a single thread.
	 */
	public final class Guard implements AutoCloseable {
		@Getter @Accessors(fluent = true) private final String key;
		private final Entry entry;
		private final long signalsAtRegistration;
		private boolean closed = false;

		private Guard(Entry entry) {
			this.key = entry.key;
			this.entry = entry;
			this.signalsAtRegistration = entry.signals.get();
		}

		/**
		 * Blocks until <code>predicate</code> holds or <code>deadlineNanos</code> passes.
		 * The predicate is evaluated on entry and again after every signal.
		 *
		 * @param deadlineNanos a deadline on the {@link System#nanoTime()} timeline
		 * @return true if the predicate held; false on timeout
		 */
		public boolean waitUntil(long deadlineNanos, BooleanSupplier predicate) throws InterruptedException {
			Thread me = Thread.currentThread();
			entry.parked.add(me);
			try {
				while (true) {
					long observed = entry.signals.get();
					if (predicate.getAsBoolean()) {
						return true;
					}
					if (entry.signals.get() != observed) {
						continue;
					}
					long remaining = deadlineNanos - System.nanoTime();
					if (remaining <= 0) {
						return false;
					}
					LockSupport.parkNanos(entry, remaining);
					if (Thread.interrupted()) {
						throw new InterruptedException("Interrupted while waiting on " + key);
					}
				}
			} finally {
				entry.parked.remove(me);
			}
		}

		/**
		 * Blocks until this entry has been signaled at least once since the guard was created.
		 *
		 * @return true if signaled; false on timeout
		 */
		public boolean waitUntil(long deadlineNanos) throws InterruptedException {
			return waitUntil(deadlineNanos, () -> entry.signals.get() != signalsAtRegistration);
		}

		public boolean waitFor(Duration timeout, BooleanSupplier predicate) throws InterruptedException {
			return waitUntil(System.nanoTime() + timeout.toNanos(), predicate);
		}

		@Override
		public void close() {
			if (closed) {
				return;
			}
			closed = true;
			registryLock.lock();
			try {
				entry.guards--;
				if (entry.guards == 0 && entries.get(key) == entry) {
					entries.remove(key);
				}
			} finally {
				registryLock.unlock();
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WaitMap.class);
}
