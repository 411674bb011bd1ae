package io.vena.pathspace.codecs;

import io.vena.pathspace.exceptions.CodecException;

/**
 * Converts values of one exact type to and from the byte payloads stored in a slot.
 */
public interface Codec<T> {
	Class<T> type();

	byte[] encode(T value) throws CodecException;

	T decode(byte[] payload) throws CodecException;
}
