package io.vena.pathspace.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.pathspace.codecs.Codec;
import io.vena.pathspace.codecs.CodecProvider;
import io.vena.pathspace.codecs.CodecRegistry;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies {@link JacksonCodec}s, so a {@link io.vena.pathspace.PathSpace} can store
 * ordinary Jackson-compatible objects without registering a codec for each class.
 *
 * <p>
 * By default, only classes outside the <code>java.</code> and <code>javax.</code> packages
 * are handled; JDK types are left to {@link io.vena.pathspace.codecs.StandardCodecs}.
 */
public final class JacksonCodecProvider implements CodecProvider {
	private final ObjectMapper mapper;
	private final Predicate<Class<?>> accepts;

	public JacksonCodecProvider() {
		this(defaultMapper());
	}

	public JacksonCodecProvider(ObjectMapper mapper) {
		this(mapper, JacksonCodecProvider::isApplicationClass);
	}

	public JacksonCodecProvider(ObjectMapper mapper, Predicate<Class<?>> accepts) {
		this.mapper = mapper;
		this.accepts = accepts;
	}

	/**
	 * Only types in the given packages (or their subpackages) get codecs.
	 */
	public static JacksonCodecProvider forPackages(ObjectMapper mapper, String... packageNames) {
		List<String> prefixes = List.of(packageNames);
		return new JacksonCodecProvider(mapper, type -> prefixes.stream().anyMatch(p ->
			type.getName().startsWith(p + ".")));
	}

	/**
	 * Convenience method for the common case.
	 */
	public static CodecRegistry registryWith(JacksonCodecProvider provider) {
		return CodecRegistry.withStandardCodecs().addProvider(provider);
	}

	@Override
	public @Nullable <T> Codec<T> codecFor(Class<T> type) {
		if (type.isPrimitive() || type.isArray() || type.isInterface() || !accepts.test(type)) {
			return null;
		}
		if (!mapper.canSerialize(type)) {
			LOGGER.debug("Jackson can't serialize {}", type.getName());
			return null;
		}
		LOGGER.debug("Creating JSON codec for {}", type.getName());
		return new JacksonCodec<>(type, mapper.readerFor(type), mapper.writerFor(type));
	}

	static ObjectMapper defaultMapper() {
		return new ObjectMapper()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
	}

	private static boolean isApplicationClass(Class<?> type) {
		String name = type.getName();
		return !name.startsWith("java.") && !name.startsWith("javax.");
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonCodecProvider.class);
}
