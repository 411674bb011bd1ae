package io.vena.pathspace.codecs;

import io.vena.pathspace.exceptions.CodecException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;

/**
 * Codecs for strings, boxed primitives, and byte arrays.
 */
public final class StandardCodecs {
	private StandardCodecs() { }

	public static final Codec<String> STRING = new Codec<>() {
		@Override public Class<String> type() { return String.class; }
		@Override public byte[] encode(String value) { return value.getBytes(StandardCharsets.UTF_8); }
		@Override public String decode(byte[] payload) { return new String(payload, StandardCharsets.UTF_8); }
	};

	public static final Codec<byte[]> BYTES = new Codec<>() {
		@Override public Class<byte[]> type() { return byte[].class; }
		@Override public byte[] encode(byte[] value) { return Arrays.copyOf(value, value.length); }
		@Override public byte[] decode(byte[] payload) { return Arrays.copyOf(payload, payload.length); }
	};

	public static final Codec<Integer> INTEGER = new FixedWidth<>(Integer.class, Integer.BYTES, (b,v) -> b.putInt(v), ByteBuffer::getInt);
	public static final Codec<Long> LONG = new FixedWidth<>(Long.class, Long.BYTES, (b,v) -> b.putLong(v), ByteBuffer::getLong);
	public static final Codec<Short> SHORT = new FixedWidth<>(Short.class, Short.BYTES, (b,v) -> b.putShort(v), ByteBuffer::getShort);
	public static final Codec<Byte> BYTE = new FixedWidth<>(Byte.class, Byte.BYTES, (b,v) -> b.put(v), ByteBuffer::get);
	public static final Codec<Double> DOUBLE = new FixedWidth<>(Double.class, Double.BYTES, (b,v) -> b.putDouble(v), ByteBuffer::getDouble);
	public static final Codec<Float> FLOAT = new FixedWidth<>(Float.class, Float.BYTES, (b,v) -> b.putFloat(v), ByteBuffer::getFloat);
	public static final Codec<Character> CHARACTER = new FixedWidth<>(Character.class, Character.BYTES, (b,v) -> b.putChar(v), ByteBuffer::getChar);
	public static final Codec<Boolean> BOOLEAN = new FixedWidth<>(Boolean.class, 1, (b,v) -> b.put((byte) (v ? 1 : 0)), b -> b.get() != 0);

	public static List<Codec<?>> all() {
		return List.of(STRING, BYTES, INTEGER, LONG, SHORT, BYTE, DOUBLE, FLOAT, CHARACTER, BOOLEAN);
	}

	@RequiredArgsConstructor
	private static final class FixedWidth<T> implements Codec<T> {
		private final Class<T> type;
		private final int width;
		private final BiConsumer<ByteBuffer, T> writer;
		private final Function<ByteBuffer, T> reader;

		@Override
		public Class<T> type() {
			return type;
		}

		@Override
		public byte[] encode(T value) {
			ByteBuffer buffer = ByteBuffer.allocate(width);
			writer.accept(buffer, value);
			return buffer.array();
		}

		@Override
		public T decode(byte[] payload) throws CodecException {
			if (payload.length != width) {
				throw new CodecException("Expected " + width + " bytes for " + type.getSimpleName() + "; got " + payload.length);
			}
			return reader.apply(ByteBuffer.wrap(payload));
		}
	}
}
