package io.vena.pathspace;

import lombok.NonNull;
import lombok.Value;

/**
 * A deferred computation that can be inserted into a {@link PathSpace} in place of a value.
 * Readers of the slot see the computed value, typed as {@link #resultType()}.
 *
 * <p>
 * Inserting one task at a glob path schedules a separate execution for each matched node.
 */
@Value
public class Task<T> {
	@NonNull Class<T> resultType;
	@NonNull TaskFunction<T> function;
	@NonNull ExecutionOptions options;

	public static <TT> Task<TT> immediate(Class<TT> resultType, TaskFunction<TT> function) {
		return new Task<>(resultType, function, ExecutionOptions.immediate());
	}

	public static <TT> Task<TT> lazy(Class<TT> resultType, TaskFunction<TT> function) {
		return new Task<>(resultType, function, ExecutionOptions.lazy());
	}

	public static <TT> Task<TT> of(Class<TT> resultType, TaskFunction<TT> function, ExecutionOptions options) {
		return new Task<>(resultType, function, options);
	}

	public TaskCategory category() {
		return options.category();
	}
}
