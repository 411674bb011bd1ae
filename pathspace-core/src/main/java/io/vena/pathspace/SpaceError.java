package io.vena.pathspace;

import java.util.Optional;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Describes why a {@link PathSpace} operation failed.
 * Named to avoid confusion with {@link java.lang.Error}.
 */
@Value
public class SpaceError {
	@NonNull ErrorCode code;
	@Nullable String message;

	public static SpaceError of(ErrorCode code) {
		return new SpaceError(code, null);
	}

	public static SpaceError of(ErrorCode code, String message) {
		return new SpaceError(code, message);
	}

	public Optional<String> optionalMessage() {
		return Optional.ofNullable(message);
	}

	@Override
	public String toString() {
		if (message == null) {
			return code.name();
		} else {
			return code + ": " + message;
		}
	}
}
