package io.vena.pathspace;

import io.vena.pathspace.codecs.Codec;
import io.vena.pathspace.exceptions.CodecException;
import io.vena.pathspace.tasks.TaskState;
import io.vena.pathspace.tasks.TaskToken;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.pathspace.ErrorCode.TASK_FAILED;
import static io.vena.pathspace.ErrorCode.TIMEOUT;
import static io.vena.pathspace.ErrorCode.UNSERIALIZABLE_TYPE;

/**
 * The run-once state of a {@link Task} sitting in one slot at one concrete path.
 *
 * <p>
 * Whoever wins the {@link TaskState#UNSCHEDULED} to {@link TaskState#RUNNING} transition
 * runs the function: a pool worker for immediate tasks, the first reader for lazy ones.
 * The encoded result is published before the state becomes {@link TaskState#DONE},
 * and <code>onDone</code> is called after that so waiters can be woken.
 *
 * <p>
 * Implements {@link Runnable} so the slot's own reference to this object is what keeps
 * the pool's weakly-held queue entry alive.
 */
final class TaskExecution<T> implements Runnable {
	private final Task<T> task;
	private final Codec<T> codec;
	private final Path path;
	private final String spaceName;
	private final TaskToken token;
	private final SpaceDiagnosticContext diagnosticContext;
	private final Map<String, String> diagnosticAttributes;
	private final Consumer<TaskExecution<?>> onDone;
	private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.UNSCHEDULED);
	private volatile Expected<byte[]> result = null;

	TaskExecution(Task<T> task, Codec<T> codec, Path path, String spaceName, TaskToken token, SpaceDiagnosticContext diagnosticContext, Consumer<TaskExecution<?>> onDone) {
		this.task = task;
		this.codec = codec;
		this.path = path;
		this.spaceName = spaceName;
		this.token = token;
		this.diagnosticContext = diagnosticContext;
		this.diagnosticAttributes = diagnosticContext.getAttributes();
		this.onDone = onDone;
	}

	Class<T> resultType() {
		return task.resultType();
	}

	TaskCategory category() {
		return task.category();
	}

	Task<T> task() {
		return task;
	}

	Path path() {
		return path;
	}

	TaskState state() {
		return state.get();
	}

	boolean isDone() {
		return state.get() == TaskState.DONE;
	}

	/**
	 * @throws IllegalStateException if not yet done
	 */
	Expected<byte[]> result() {
		if (!isDone()) {
			throw new IllegalStateException("Task at " + path + " is " + state.get());
		}
		return result;
	}

	/**
	 * Runs the task if nobody has started it yet.
	 *
	 * @return true if this call ran it
	 */
	boolean runIfUnscheduled() {
		if (state.compareAndSet(TaskState.UNSCHEDULED, TaskState.RUNNING)) {
			execute();
			return true;
		} else {
			return false;
		}
	}

	@Override
	public void run() {
		if (!runIfUnscheduled()) {
			LOGGER.debug("Task at {} was already {}", path, state.get());
		}
	}

	private void execute() {
		// Completion runs inside the diagnostic scope too, so hooks it triggers see the inserter's context
		try (var __ = diagnosticContext.withOnly(diagnosticAttributes)) {
			try {
				if (token.tryRegister()) {
					try {
						result = callFunction();
					} finally {
						token.release();
					}
				} else {
					LOGGER.debug("Not running task at {}: space is shutting down", path);
					result = Expected.failure(TIMEOUT, "PathSpace shut down before task at " + path + " could run");
				}
			} finally {
				state.set(TaskState.DONE);
				onDone.accept(this);
			}
		}
	}

	private Expected<byte[]> callFunction() {
		try (var __ = MappedDiagnosticContext.setupMDC(spaceName, path.toString())) {
			T value;
			try {
				LOGGER.debug("Task: RUN {}", path);
				value = task.function().call();
			} catch (Exception e) {
				LOGGER.debug("Task at {} failed: {}", path, e.getMessage(), e);
				return Expected.failure(TASK_FAILED, "Task at " + path + " threw " + e);
			}
			if (value == null) {
				return Expected.failure(TASK_FAILED, "Task at " + path + " returned null");
			}
			try {
				return Expected.of(codec.encode(value));
			} catch (CodecException e) {
				LOGGER.debug("Unable to encode result of task at {}", path, e);
				return Expected.failure(UNSERIALIZABLE_TYPE, "Unable to encode result of task at " + path + ": " + e.getMessage());
			}
		}
	}

	@Override
	public String toString() {
		return "TaskExecution(" + path + ", " + task.category() + ", " + state.get() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TaskExecution.class);
}
