package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One lexical unit produced by {@link JerryTokenizer}: a punctuation character, a string literal or a number.
 * The set of subclasses is closed; use {@link #kind} to tell them apart.
 */
public abstract class Token {

	public enum Kind {
		PUNCTUATION,
		STRING,
		NUMBER
	}

	public static final Punctuation OPEN_BRACE = new Punctuation('{');
	public static final Punctuation CLOSE_BRACE = new Punctuation('}');
	public static final Punctuation OPEN_BRACKET = new Punctuation('[');
	public static final Punctuation CLOSE_BRACKET = new Punctuation(']');
	public static final Punctuation COLON = new Punctuation(':');
	public static final Punctuation COMMA = new Punctuation(',');

	@NotNull
	public final Kind kind;

	private Token(@NotNull Kind kind) {
		this.kind = kind;
	}

	/**
	 * @return the punctuation token for the given character
	 * @throws IllegalArgumentException if the character is not one of <code>{}[]:,</code>
	 */
	@NotNull
	@Contract(pure = true)
	public static Punctuation punctuation(char symbol) {
		return switch (symbol) {
			case '{' -> OPEN_BRACE;
			case '}' -> CLOSE_BRACE;
			case '[' -> OPEN_BRACKET;
			case ']' -> CLOSE_BRACKET;
			case ':' -> COLON;
			case ',' -> COMMA;
			default -> throw new IllegalArgumentException("Not a punctuation character: " + symbol);
		};
	}

	@NotNull
	@Contract("_ -> new")
	public static StringLiteral string(@NotNull String text) {
		return new StringLiteral(text);
	}

	@NotNull
	@Contract("_ -> new")
	public static NumberLiteral number(@NotNull Number value) {
		return new NumberLiteral(value);
	}

	public static final class Punctuation extends Token {
		public final char symbol;

		private Punctuation(char symbol) {
			super(Kind.PUNCTUATION);
			this.symbol = symbol;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Punctuation p && p.symbol == symbol;
		}

		@Override
		public int hashCode() {
			return symbol;
		}

		@Override
		public String toString() {
			return String.valueOf(symbol);
		}
	}

	/**
	 * A string literal. {@link #text} still includes the surrounding quotes.
	 */
	public static final class StringLiteral extends Token {
		@NotNull
		public final String text;

		private StringLiteral(@NotNull String text) {
			super(Kind.STRING);
			if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"')
				throw new IllegalArgumentException("String literal must be enclosed in double quotes: " + text);

			this.text = text;
		}

		/**
		 * @return the literal without its enclosing quotes
		 */
		@NotNull
		public String contents() {
			return text.substring(1, text.length() - 1);
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof StringLiteral s && s.text.equals(text);
		}

		@Override
		public int hashCode() {
			return text.hashCode();
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * A number, already converted from text. Floating-point numbers are {@link Double}s; integers are
	 * {@link Integer}, {@link Long} or {@link BigInteger}, whichever is the narrowest that fits.
	 */
	public static final class NumberLiteral extends Token {
		@NotNull
		public final Number value;

		private NumberLiteral(@NotNull Number value) {
			super(Kind.NUMBER);
			this.value = JerryValue.normalize(Objects.requireNonNull(value, "value"));
		}

		public boolean isFloat() {
			return value instanceof Double;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof NumberLiteral n && n.value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}
}
