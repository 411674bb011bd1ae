package io.vena.pathspace.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.vena.pathspace.codecs.Codec;
import io.vena.pathspace.exceptions.CodecException;
import java.io.IOException;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Stores values of one type as UTF-8 JSON.
 */
@Accessors(fluent = true)
public final class JacksonCodec<T> implements Codec<T> {
	@Getter private final Class<T> type;
	private final ObjectReader reader;
	private final ObjectWriter writer;

	JacksonCodec(Class<T> type, ObjectReader reader, ObjectWriter writer) {
		this.type = type;
		this.reader = reader;
		this.writer = writer;
	}

	@Override
	public byte[] encode(T value) throws CodecException {
		try {
			return writer.writeValueAsBytes(value);
		} catch (JsonProcessingException e) {
			throw new CodecException("Unable to write " + type.getSimpleName() + " as JSON", e);
		}
	}

	@Override
	public T decode(byte[] payload) throws CodecException {
		T result;
		try {
			result = reader.readValue(payload);
		} catch (IOException e) {
			throw new CodecException("Unable to read " + type.getSimpleName() + " from JSON", e);
		}
		if (result == null) {
			throw new CodecException("JSON for " + type.getSimpleName() + " was null");
		}
		return result;
	}

	@Override
	public String toString() {
		return "JacksonCodec(" + type.getSimpleName() + ")";
	}
}
