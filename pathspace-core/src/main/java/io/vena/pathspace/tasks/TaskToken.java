package io.vena.pathspace.tasks;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the tasks currently executing on behalf of one owner,
 * so the owner's teardown can wait for them to finish.
 *
 * <p>
 * Once {@link #invalidate() invalidated}, no further task can {@link #tryRegister() register}.
 */
public final class TaskToken {
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition idle = lock.newCondition();
	private int inFlight = 0;
	private boolean valid = true;

	/**
	 * @return true if the caller may run its task, in which case it must later call {@link #release()};
	 * false if this token has been invalidated.
	 */
	public boolean tryRegister() {
		lock.lock();
		try {
			if (valid) {
				inFlight++;
				return true;
			} else {
				return false;
			}
		} finally {
			lock.unlock();
		}
	}

	public void release() {
		lock.lock();
		try {
			if (inFlight <= 0) {
				throw new IllegalStateException("Release without matching registration");
			}
			inFlight--;
			if (inFlight == 0) {
				idle.signalAll();
			}
		} finally {
			lock.unlock();
		}
	}

	public void invalidate() {
		lock.lock();
		try {
			valid = false;
		} finally {
			lock.unlock();
		}
	}

	public boolean isValid() {
		lock.lock();
		try {
			return valid;
		} finally {
			lock.unlock();
		}
	}

	public int inFlight() {
		lock.lock();
		try {
			return inFlight;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Invalidates this token and waits for in-flight tasks to finish.
	 *
	 * @return true if all tasks finished; false if <code>timeout</code> elapsed first
	 */
	public boolean invalidateAndAwait(Duration timeout) throws InterruptedException {
		lock.lock();
		try {
			valid = false;
			long remaining = timeout.toNanos();
			while (inFlight > 0) {
				if (remaining <= 0) {
					LOGGER.warn("Gave up waiting for {} in-flight task{}", inFlight, (inFlight >= 2)? "s":"");
					return false;
				}
				remaining = idle.awaitNanos(remaining);
			}
			return true;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public String toString() {
		return "TaskToken(inFlight=" + inFlight() + ", valid=" + isValid() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TaskToken.class);
}
