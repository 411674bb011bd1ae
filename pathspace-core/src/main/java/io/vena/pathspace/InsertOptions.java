package io.vena.pathspace;

import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class InsertOptions {
	@Default Capabilities capabilities = Capabilities.all();

	/**
	 * If set, inserted slots become invisible once this much time has passed.
	 */
	@Default @Nullable Duration ttl = null;

	/**
	 * The most slots one insert call may append. A glob insert that matches more nodes
	 * than this reports {@link ErrorCode#CAPACITY_EXCEEDED} for the excess.
	 */
	@Default int maxInsertions = Integer.MAX_VALUE;

	/**
	 * If false, a node whose lock is held by another thread is reported as
	 * {@link ErrorCode#TIMEOUT} instead of being waited for.
	 */
	@Default boolean waitForLocks = true;

	@Default ValidationLevel validationLevel = ValidationLevel.BASIC;

	public static InsertOptions defaults() {
		return DEFAULTS;
	}

	public static InsertOptions withCapabilities(Capabilities capabilities) {
		return builder().capabilities(capabilities).build();
	}

	public static InsertOptions withTtl(Duration ttl) {
		return builder().ttl(ttl).build();
	}

	private static final InsertOptions DEFAULTS = InsertOptions.builder().build();
}
