package io.vena.pathspace;

import io.vena.pathspace.exceptions.SpaceErrorException;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of a {@link PathSpace} operation: exactly one of a value or a {@link SpaceError}.
 *
 * <p>
 * Unlike {@link Optional}, an absent value always says why it's absent.
 *
 * @param <T> the type of the value on success
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Expected<T> {
	private final @Nullable T value;
	private final @Nullable SpaceError error;

	public static <TT> Expected<TT> of(@NotNull TT value) {
		return new Expected<>(requireNonNull(value), null);
	}

	public static <TT> Expected<TT> failure(@NotNull SpaceError error) {
		return new Expected<>(null, requireNonNull(error));
	}

	public static <TT> Expected<TT> failure(ErrorCode code, String message) {
		return failure(SpaceError.of(code, message));
	}

	public boolean hasValue() {
		return error == null;
	}

	public boolean hasError() {
		return error != null;
	}

	/**
	 * @throws SpaceErrorException if this holds an error
	 */
	public @NotNull T value() {
		if (error != null) {
			throw new SpaceErrorException(error);
		}
		return value;
	}

	/**
	 * @throws IllegalStateException if this holds a value
	 */
	public @NotNull SpaceError error() {
		if (error == null) {
			throw new IllegalStateException("Expected holds a value, not an error");
		}
		return error;
	}

	/**
	 * @return the error code, or null if this holds a value
	 */
	public @Nullable ErrorCode errorCode() {
		return error == null ? null : error.code();
	}

	public T orElse(T other) {
		return error == null ? value : other;
	}

	public Optional<T> toOptional() {
		return Optional.ofNullable(value);
	}

	public void ifPresent(Consumer<? super T> action) {
		if (error == null) {
			action.accept(value);
		}
	}

	public <U> Expected<U> map(Function<? super T, ? extends U> mapper) {
		if (error == null) {
			return Expected.of(mapper.apply(value));
		} else {
			return propagate();
		}
	}

	public <U> Expected<U> flatMap(Function<? super T, Expected<U>> mapper) {
		if (error == null) {
			return mapper.apply(value);
		} else {
			return propagate();
		}
	}

	/**
	 * Re-types a failed result so the error can be returned from a method with a different value type.
	 *
	 * @throws IllegalStateException if this holds a value
	 */
	@SuppressWarnings("unchecked")
	public <U> Expected<U> propagate() {
		if (error == null) {
			throw new IllegalStateException("Cannot propagate a successful result");
		}
		return (Expected<U>) this;
	}

	@Override
	public String toString() {
		if (error == null) {
			return "Expected(" + value + ")";
		} else {
			return "Expected(" + error + ")";
		}
	}
}
