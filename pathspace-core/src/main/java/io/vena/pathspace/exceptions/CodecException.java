package io.vena.pathspace.exceptions;

import io.vena.pathspace.codecs.Codec;
import java.io.IOException;

/**
 * Indicates that a {@link Codec} could not convert between a value and its byte payload.
 *
 * <p>
 * Extends {@link IOException} because callers that already handle that
 * will usually do the right thing for this too.
 */
public class CodecException extends IOException {
	public CodecException(String message) { super(message); }
	public CodecException(String message, Throwable cause) { super(message, cause); }
	public CodecException(Throwable cause) { super(cause); }
}
