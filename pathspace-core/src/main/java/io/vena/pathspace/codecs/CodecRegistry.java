package io.vena.pathspace.codecs;

import io.vena.pathspace.ErrorCode;
import io.vena.pathspace.Expected;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Looks up the {@link Codec} for a type by exact class identity.
 *
 * <p>
 * Explicitly registered codecs win; otherwise providers are consulted in the order
 * they were added, and the first answer is cached.
 */
public final class CodecRegistry {
	private final Map<Class<?>, Codec<?>> codecs = new ConcurrentHashMap<>();
	private final List<CodecProvider> providers = new CopyOnWriteArrayList<>();

	/**
	 * @return a registry with no codecs at all
	 */
	public static CodecRegistry empty() {
		return new CodecRegistry();
	}

	/**
	 * @return a registry preloaded with {@link StandardCodecs}
	 */
	public static CodecRegistry withStandardCodecs() {
		CodecRegistry result = new CodecRegistry();
		StandardCodecs.all().forEach(result::register);
		return result;
	}

	public <T> CodecRegistry register(Codec<T> codec) {
		Codec<?> previous = codecs.put(requireNonNull(codec.type()), codec);
		if (previous != null && previous != codec) {
			LOGGER.debug("Replaced codec for {}", codec.type().getName());
		}
		return this;
	}

	public CodecRegistry addProvider(CodecProvider provider) {
		providers.add(requireNonNull(provider));
		return this;
	}

	@SuppressWarnings("unchecked")
	public <T> Expected<Codec<T>> lookup(Class<T> type) {
		Codec<T> existing = (Codec<T>) codecs.get(type);
		if (existing != null) {
			return Expected.of(existing);
		}
		for (CodecProvider provider: providers) {
			Codec<T> provided = provider.codecFor(type);
			if (provided != null) {
				codecs.putIfAbsent(type, provided);
				return Expected.of((Codec<T>) codecs.get(type));
			}
		}
		return Expected.failure(ErrorCode.SERIALIZATION_FUNCTION_MISSING, "No codec for " + type.getName());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CodecRegistry.class);
}
