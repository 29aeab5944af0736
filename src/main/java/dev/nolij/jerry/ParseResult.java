package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The outcome of a pipeline stage: either a value or the {@link ParseError} that stopped the stage.
 * @param <T> the type of the value on success
 */
public final class ParseResult<T> {

	@Nullable
	private final T value;

	@Nullable
	private final ParseError error;

	private ParseResult(@Nullable T value, @Nullable ParseError error) {
		this.value = value;
		this.error = error;
	}

	@NotNull
	@Contract("_ -> new")
	public static <T> ParseResult<T> success(@NotNull T value) {
		return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
	}

	@NotNull
	@Contract("_ -> new")
	public static <T> ParseResult<T> failure(@NotNull ParseError error) {
		return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
	}

	public boolean isSuccess() {
		return error == null;
	}

	/**
	 * @return the value of a successful result
	 * @throws IllegalStateException if this result is a failure
	 */
	@NotNull
	public T get() {
		if (error != null)
			throw new IllegalStateException("No value present: " + error);

		return value;
	}

	/**
	 * @return the error of a failed result, or {@code null} on success
	 */
	@Nullable
	public ParseError getError() {
		return error;
	}

	/**
	 * @return the value of a successful result
	 * @throws ParseException carrying the error if this result is a failure
	 */
	@NotNull
	public T orElseThrow() throws ParseException {
		if (error != null)
			throw new ParseException(error);

		return value;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof ParseResult<?> r
			&& Objects.equals(value, r.value)
			&& Objects.equals(error, r.error);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, error);
	}

	@Override
	public String toString() {
		return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
	}
}
