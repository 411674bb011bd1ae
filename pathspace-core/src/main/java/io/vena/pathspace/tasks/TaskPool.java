package io.vena.pathspace.tasks;

import io.vena.pathspace.exceptions.TaskRejectedException;
import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.Value;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static io.vena.pathspace.MdcKeys.SPACE_NAME;

/**
 * A fixed set of worker threads draining one shared queue of tasks.
 *
 * <p>
 * The queue holds tasks only by {@link WeakReference}: whoever submits a task must keep it
 * reachable until it runs. A task that becomes unreachable first is silently skipped, which is
 * how a discarded slot orphans its unexecuted work.
 *
 * <p>
 * Higher priorities run first; equal priorities run in submission order.
 */
@Accessors(fluent = true)
public final class TaskPool {
	@Getter private final String name;
	private final PriorityBlockingQueue<Queued> queue = new PriorityBlockingQueue<>(16, QUEUE_ORDER);
	private final List<Thread> workers;
	private final AtomicLong sequenceCounter = new AtomicLong();
	private final ScheduledExecutorService delayer;
	private final ReentrantLock intakeLock = new ReentrantLock();

	/**
	 * Written under {@link #intakeLock}, so no task is queued behind the shutdown markers.
	 */
	private volatile boolean accepting = true;

	public TaskPool(String name, int threadCount) {
		if (threadCount < 1) {
			throw new IllegalArgumentException("Task pool needs at least one thread; got " + threadCount);
		}
		this.name = name;
		this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, name + "-delayer");
			t.setDaemon(true);
			return t;
		});
		List<Thread> threads = new ArrayList<>(threadCount);
		for (int i = 0; i < threadCount; i++) {
			Thread t = new Thread(this::workLoop, name + "-worker-" + i);
			t.setDaemon(true);
			threads.add(t);
		}
		this.workers = List.copyOf(threads);
		workers.forEach(Thread::start);
		LOGGER.debug("Started task pool {} with {} threads", name, threadCount);
	}

	public static TaskPool withDefaultThreadCount(String name) {
		return new TaskPool(name, Runtime.getRuntime().availableProcessors());
	}

	public int threadCount() {
		return workers.size();
	}

	public int queuedCount() {
		// Don't count the shutdown markers
		return (int) queue.stream().filter(q -> q.task != null).count();
	}

	public boolean isAccepting() {
		return accepting;
	}

	/**
	 * @throws TaskRejectedException if {@link #shutdown} has been called
	 */
	public void submit(Runnable task, int priority) {
		if (!enqueue(task, priority)) {
			throw new TaskRejectedException("Task pool " + name + " is shut down");
		}
	}

	private boolean enqueue(Runnable task, int priority) {
		intakeLock.lock();
		try {
			if (!accepting) {
				return false;
			}
			queue.add(new Queued(priority, sequenceCounter.getAndIncrement(), new WeakReference<>(task)));
			return true;
		} finally {
			intakeLock.unlock();
		}
	}

	/**
	 * Like {@link #submit(Runnable, int)} but the task becomes eligible to run
	 * only after <code>delay</code>. The delayed task is also held weakly.
	 */
	public void submit(Runnable task, int priority, Duration delay) {
		if (delay.isZero() || delay.isNegative()) {
			submit(task, priority);
			return;
		}
		if (!accepting) {
			throw new TaskRejectedException("Task pool " + name + " is shut down");
		}
		WeakReference<Runnable> ref = new WeakReference<>(task);
		delayer.schedule(() -> {
			Runnable stillWanted = ref.get();
			if (stillWanted == null) {
				LOGGER.trace("Delayed task was discarded before it became eligible");
			} else if (!enqueue(stillWanted, priority)) {
				LOGGER.debug("Dropping delayed task because pool {} is shutting down", name);
			}
		}, delay.toNanos(), TimeUnit.NANOSECONDS);
	}

	/**
	 * Stops accepting tasks, lets the workers finish everything already queued, and joins them.
	 *
	 * @return true if every worker finished within <code>timeout</code>
	 */
	public boolean shutdown(Duration timeout) throws InterruptedException {
		intakeLock.lock();
		try {
			if (accepting) {
				accepting = false;
				delayer.shutdownNow();
				// One marker per worker. Markers sort after every real task.
				workers.forEach(w -> queue.add(new Queued(Integer.MIN_VALUE, Long.MAX_VALUE, null)));
				LOGGER.debug("Shutting down task pool {} with {} queued tasks", name, queuedCount());
			}
		} finally {
			intakeLock.unlock();
		}
		long deadline = System.nanoTime() + timeout.toNanos();
		for (Thread worker: workers) {
			long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
			if (remainingMillis > 0) {
				worker.join(remainingMillis);
			}
			if (worker.isAlive()) {
				LOGGER.warn("Worker {} did not finish within {}", worker.getName(), timeout);
				return false;
			}
		}
		return true;
	}

	private void workLoop() {
		MDC.put(SPACE_NAME, name);
		try {
			while (true) {
				Queued next = queue.take();
				if (next.task == null) {
					LOGGER.trace("Worker exiting");
					return;
				}
				Runnable task = next.task.get();
				if (task == null) {
					LOGGER.trace("Skipping orphaned task #{}", next.sequence);
					continue;
				}
				try {
					task.run();
				} catch (RuntimeException e) {
					LOGGER.error("Task #{} aborted due to exception: {}", next.sequence, e.getMessage(), e);
				}
			}
		} catch (InterruptedException e) {
			LOGGER.warn("Worker interrupted; exiting", e);
			Thread.currentThread().interrupt();
		} finally {
			MDC.remove(SPACE_NAME);
		}
	}

	@Value
	private static class Queued {
		int priority;
		long sequence;
		WeakReference<Runnable> task;
	}

	private static final Comparator<Queued> QUEUE_ORDER = ((Comparator<Queued>) (a, b) -> Integer.compare(b.priority, a.priority))
		.thenComparingLong(q -> q.sequence);

	private static final Logger LOGGER = LoggerFactory.getLogger(TaskPool.class);
}
