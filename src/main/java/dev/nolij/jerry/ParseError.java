package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Describes why tokenizing or parsing failed.
 */
public final class ParseError {

	public enum Kind {
		/** A reader was advanced past the end of its input. */
		OUT_OF_BOUNDS,
		/** The tokenizer saw a character that cannot start a token. */
		UNEXPECTED_CHARACTER,
		/** A number contained a second decimal point. */
		INVALID_NUMBER,
		/** A required character or token did not match. */
		MISMATCHED_EXPECTATION,
		/** The parser could not read a token as a value or key. */
		UNEXPECTED_VALUE,
		/** Tokens remained after the top-level value. */
		TRAILING_TOKENS,
		/** The document did not start with an object or an array. */
		INVALID_ROOT
	}

	@NotNull
	public final Kind kind;

	/**
	 * Index into the character sequence (tokenizer) or token sequence (parser) where the error was found.
	 */
	public final int position;

	/**
	 * What was required, for {@link Kind#MISMATCHED_EXPECTATION}.
	 */
	@Nullable
	public final Object expected;

	/**
	 * The offending character or token, if there was one.
	 */
	@Nullable
	public final Object actual;

	@NotNull
	public final String message;

	private ParseError(@NotNull Kind kind, int position, @Nullable Object expected, @Nullable Object actual, @NotNull String message) {
		this.kind = kind;
		this.position = position;
		this.expected = expected;
		this.actual = actual;
		this.message = message;
	}

	@NotNull
	@Contract("_ -> new")
	public static ParseError outOfBounds(int position) {
		return new ParseError(Kind.OUT_OF_BOUNDS, position, null, null,
			"Unexpected end of input at index " + position);
	}

	@NotNull
	@Contract("_, _ -> new")
	public static ParseError unexpectedCharacter(char ch, int position) {
		return new ParseError(Kind.UNEXPECTED_CHARACTER, position, null, ch,
			"Unexpected char '" + ch + "' at index " + position);
	}

	@NotNull
	@Contract("_ -> new")
	public static ParseError invalidNumber(int position) {
		return new ParseError(Kind.INVALID_NUMBER, position, null, '.',
			"Invalid number: second decimal point at index " + position);
	}

	@NotNull
	@Contract("_, _, _ -> new")
	public static ParseError mismatchedExpectation(@NotNull Object expected, @NotNull Object actual, int position) {
		return new ParseError(Kind.MISMATCHED_EXPECTATION, position, expected, actual,
			"Expected '" + expected + "', got '" + actual + "' at index " + position);
	}

	@NotNull
	@Contract("_, _ -> new")
	public static ParseError unexpectedValue(@NotNull Token token, int position) {
		return new ParseError(Kind.UNEXPECTED_VALUE, position, null, token,
			"Unexpected value: '" + token + "' at token " + position);
	}

	@NotNull
	@Contract("_, _ -> new")
	public static ParseError trailingTokens(@NotNull Token token, int position) {
		return new ParseError(Kind.TRAILING_TOKENS, position, null, token,
			"Unexpected token at end of input: '" + token + "' at token " + position);
	}

	@NotNull
	@Contract("_, _ -> new")
	public static ParseError invalidRoot(@Nullable Token token, int position) {
		String message = token == null
			? "Expected an object or an array, got end of input"
			: "Expected an object or an array, got '" + token + "' at token " + position;
		return new ParseError(Kind.INVALID_ROOT, position, null, token, message);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof ParseError e
			&& kind == e.kind
			&& position == e.position
			&& Objects.equals(expected, e.expected)
			&& Objects.equals(actual, e.actual);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, position, expected, actual);
	}

	@Override
	public String toString() {
		return kind + ": " + message;
	}
}
