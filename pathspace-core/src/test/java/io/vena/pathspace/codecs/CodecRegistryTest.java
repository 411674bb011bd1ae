package io.vena.pathspace.codecs;

import io.vena.pathspace.exceptions.CodecException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static io.vena.pathspace.ErrorCode.SERIALIZATION_FUNCTION_MISSING;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CodecRegistryTest {

	static final class Celsius {
		final double degrees;

		Celsius(double degrees) {
			this.degrees = degrees;
		}
	}

	static final Codec<Celsius> CELSIUS = new Codec<>() {
		@Override public Class<Celsius> type() { return Celsius.class; }
		@Override public byte[] encode(Celsius value) throws CodecException { return StandardCodecs.DOUBLE.encode(value.degrees); }
		@Override public Celsius decode(byte[] payload) throws CodecException { return new Celsius(StandardCodecs.DOUBLE.decode(payload)); }
	};

	@Test
	void standardCodecs_present() {
		CodecRegistry registry = CodecRegistry.withStandardCodecs();
		assertThat(registry.lookup(Integer.class).value(), sameInstance(StandardCodecs.INTEGER));
		assertThat(registry.lookup(String.class).value(), sameInstance(StandardCodecs.STRING));
		assertThat(registry.lookup(byte[].class).value(), sameInstance(StandardCodecs.BYTES));
	}

	@Test
	void empty_reportsMissing() {
		assertThat(CodecRegistry.empty().lookup(Integer.class).errorCode(), equalTo(SERIALIZATION_FUNCTION_MISSING));
	}

	@Test
	void lookup_exactClassOnly() {
		CodecRegistry registry = CodecRegistry.withStandardCodecs();
		assertThat(registry.lookup(Number.class).errorCode(), equalTo(SERIALIZATION_FUNCTION_MISSING));
		assertThat(registry.lookup(int.class).errorCode(), equalTo(SERIALIZATION_FUNCTION_MISSING));
	}

	@Test
	void register_custom() throws CodecException {
		CodecRegistry registry = CodecRegistry.empty().register(CELSIUS);
		Codec<Celsius> codec = registry.lookup(Celsius.class).value();
		assertEquals(21.5, codec.decode(codec.encode(new Celsius(21.5))).degrees);
	}

	@Test
	void provider_consultedOnceThenCached() {
		AtomicInteger calls = new AtomicInteger();
		CodecRegistry registry = CodecRegistry.empty().addProvider(new CodecProvider() {
			@Override
			@SuppressWarnings("unchecked")
			public @Nullable <T> Codec<T> codecFor(Class<T> type) {
				calls.incrementAndGet();
				return (type == Celsius.class) ? (Codec<T>) CELSIUS : null;
			}
		});
		assertThat(registry.lookup(Celsius.class).value(), sameInstance(CELSIUS));
		assertThat(registry.lookup(Celsius.class).value(), sameInstance(CELSIUS));
		assertEquals(1, calls.get());
		assertThat(registry.lookup(Long.class).errorCode(), equalTo(SERIALIZATION_FUNCTION_MISSING));
	}

	@Test
	void fixedWidth_wrongLength_throws() {
		assertThrows(CodecException.class, () -> StandardCodecs.INTEGER.decode(new byte[3]));
		assertThrows(CodecException.class, () -> StandardCodecs.BOOLEAN.decode(new byte[0]));
	}

	@Test
	void string_utf8() throws CodecException {
		byte[] encoded = StandardCodecs.STRING.encode("héllo");
		assertArrayEquals("héllo".getBytes(StandardCharsets.UTF_8), encoded);
		assertEquals("héllo", StandardCodecs.STRING.decode(encoded));
	}

	@Test
	void bytes_copied() throws CodecException {
		byte[] original = { 1, 2, 3 };
		byte[] encoded = StandardCodecs.BYTES.encode(original);
		original[0] = 9;
		assertArrayEquals(new byte[] { 1, 2, 3 }, StandardCodecs.BYTES.decode(encoded));
	}
}
