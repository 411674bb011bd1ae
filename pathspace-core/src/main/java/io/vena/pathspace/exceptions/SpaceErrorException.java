package io.vena.pathspace.exceptions;

import io.vena.pathspace.Expected;
import io.vena.pathspace.SpaceError;
import lombok.Getter;

/**
 * Thrown by {@link Expected#value()} when called on a failed result.
 * Never thrown by {@link io.vena.pathspace.PathSpace} operations themselves.
 */
@Getter
public class SpaceErrorException extends IllegalStateException {
	private final SpaceError error;

	public SpaceErrorException(SpaceError error) {
		super(error.toString());
		this.error = error;
	}
}
