package io.vena.pathspace;

import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExecutionOptions {
	@Default TaskCategory category = TaskCategory.IMMEDIATE;

	/**
	 * Among queued {@link TaskCategory#IMMEDIATE IMMEDIATE} tasks, higher values run first.
	 * Has no effect on {@link TaskCategory#LAZY LAZY} tasks.
	 */
	@Default int priority = 0;

	/**
	 * How long an {@link TaskCategory#IMMEDIATE IMMEDIATE} task waits after insertion
	 * before it becomes eligible to run.
	 */
	@Default Duration interval = Duration.ZERO;

	public static ExecutionOptions immediate() {
		return DEFAULT;
	}

	public static ExecutionOptions lazy() {
		return LAZY;
	}

	private static final ExecutionOptions DEFAULT = ExecutionOptions.builder().build();
	private static final ExecutionOptions LAZY = ExecutionOptions.builder().category(TaskCategory.LAZY).build();
}
