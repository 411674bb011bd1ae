package io.vena.pathspace;

/**
 * The computation behind a {@link Task}. Anything it throws is reported to readers
 * as {@link ErrorCode#TASK_FAILED}.
 */
@FunctionalInterface
public interface TaskFunction<T> {
	T call() throws Exception;
}
