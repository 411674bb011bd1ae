package io.vena.pathspace;

import java.time.Duration;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class ReadOptions {
	@Default Capabilities capabilities = Capabilities.all();

	/**
	 * If true, a read that finds nothing waits for a matching insert
	 * until {@link #timeout} elapses.
	 */
	@Default boolean doBlock = false;

	/**
	 * Null means {@link PathSpaceSettings#defaultTimeout()}.
	 */
	@Default @Nullable Duration timeout = null;

	@Default ValidationLevel validationLevel = ValidationLevel.BASIC;

	public static ReadOptions defaults() {
		return DEFAULTS;
	}

	public static ReadOptions blocking(Duration timeout) {
		return builder().doBlock(true).timeout(timeout).build();
	}

	public static ReadOptions withCapabilities(Capabilities capabilities) {
		return builder().capabilities(capabilities).build();
	}

	private static final ReadOptions DEFAULTS = ReadOptions.builder().build();
}
