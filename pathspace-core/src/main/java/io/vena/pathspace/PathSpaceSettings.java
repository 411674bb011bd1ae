package io.vena.pathspace;

import io.vena.pathspace.codecs.CodecRegistry;
import java.time.Clock;
import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PathSpaceSettings {
	/**
	 * Appears in thread names and in the {@link MdcKeys#SPACE_NAME} MDC entry.
	 */
	@Default String name = "pathspace";

	@Default int workerThreads = Runtime.getRuntime().availableProcessors();

	/**
	 * How long a blocking read waits when its {@link ReadOptions#timeout()} is null.
	 */
	@Default Duration defaultTimeout = Duration.ofSeconds(10);

	/**
	 * How long a non-blocking read waits for a task that's already running
	 * (or queued) to produce its value.
	 */
	@Default Duration taskWaitTimeout = Duration.ofSeconds(10);

	/**
	 * Inserts that would make a node's queue longer than this report {@link ErrorCode#CAPACITY_EXCEEDED}.
	 */
	@Default int maxSlotsPerNode = Integer.MAX_VALUE;

	/**
	 * How often a background thread prunes expired slots. Zero disables the sweeper;
	 * expired slots are still invisible, and are pruned whenever their node is accessed.
	 */
	@Default Duration ttlSweepInterval = Duration.ZERO;

	/**
	 * Bounds how long {@link PathSpace#shutdown()} waits for running tasks.
	 */
	@Default Duration shutdownTimeout = Duration.ofSeconds(5);

	@Default Clock clock = Clock.systemUTC();

	@Default CodecRegistry codecs = CodecRegistry.withStandardCodecs();

	public static PathSpaceSettings defaults() {
		return PathSpaceSettings.builder().build();
	}

	/**
	 * @throws IllegalArgumentException if any setting is out of range
	 */
	public void validate() {
		if (name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		if (workerThreads < 1) {
			throw new IllegalArgumentException("workerThreads must be positive; got " + workerThreads);
		}
		if (maxSlotsPerNode < 1) {
			throw new IllegalArgumentException("maxSlotsPerNode must be positive; got " + maxSlotsPerNode);
		}
		requireNonNegative("defaultTimeout", defaultTimeout);
		requireNonNegative("taskWaitTimeout", taskWaitTimeout);
		requireNonNegative("ttlSweepInterval", ttlSweepInterval);
		requireNonNegative("shutdownTimeout", shutdownTimeout);
	}

	private static void requireNonNegative(String settingName, Duration value) {
		if (value.isNegative()) {
			throw new IllegalArgumentException(settingName + " must not be negative; got " + value);
		}
	}
}
