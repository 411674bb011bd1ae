package io.vena.pathspace.codecs;

import org.jetbrains.annotations.Nullable;

/**
 * Supplies codecs on demand for types that were not registered individually.
 *
 * @see CodecRegistry#addProvider
 */
public interface CodecProvider {
	/**
	 * @return a codec for exactly <code>type</code>, or null if this provider can't handle it
	 */
	@Nullable <T> Codec<T> codecFor(Class<T> type);
}
