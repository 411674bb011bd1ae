package io.vena.pathspace;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;

/**
 * One item queued at a {@link Node}: either an encoded value or a task that will produce one.
 * Slots are immutable; a task slot's mutable state lives in its {@link TaskExecution}.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class Slot {
	final Class<?> type;
	final long sequence;
	final @Nullable Instant expiry;
	private final @Nullable byte[] payload;
	final @Nullable TaskExecution<?> task;

	static Slot ofValue(Class<?> type, long sequence, @Nullable Instant expiry, byte[] payload) {
		return new Slot(type, sequence, expiry, payload, null);
	}

	static Slot ofTask(TaskExecution<?> task, long sequence, @Nullable Instant expiry) {
		return new Slot(task.resultType(), sequence, expiry, null, task);
	}

	boolean isExpiredAt(Instant now) {
		return expiry != null && !now.isBefore(expiry);
	}

	boolean isPendingTask() {
		return task != null && !task.isDone();
	}

	/**
	 * @return the encoded value. For a task slot, the task must be done.
	 */
	Expected<byte[]> payload() {
		if (task == null) {
			return Expected.of(payload);
		} else {
			return task.result();
		}
	}

	@Override
	public String toString() {
		return "Slot#" + sequence + "(" + type.getSimpleName() + (task == null ? "" : ", " + task.state()) + ")";
	}
}
