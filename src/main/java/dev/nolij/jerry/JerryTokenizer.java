package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits text into {@link Token}s.
 */
public final class JerryTokenizer {

	/**
	 * Reads every token from the given reader. Whitespace between tokens is skipped.
	 * @param input a reader positioned at the start of the text. It is exhausted on success.
	 * @return the tokens in order, or the error that stopped tokenizing. No tokens are returned on failure.
	 */
	@NotNull
	@Contract(mutates = "param")
	public static ParseResult<List<Token>> tokenize(@NotNull CursorReader<Character> input) {
		try {
			return ParseResult.success(Collections.unmodifiableList(readTokens(input)));
		} catch (ParseException e) {
			return ParseResult.failure(e.error);
		}
	}

	private static List<Token> readTokens(CursorReader<Character> input) throws ParseException {
		var tokens = new ArrayList<Token>();

		while (true) {
			skipWhitespace(input);

			Character next = input.peek();
			if (next == null)
				return tokens;

			char ch = next;
			Token token = switch (ch) {
				case '{', '}', '[', ']', ':', ',' -> Token.punctuation(input.advance());
				case '"' -> readString(input);
				default -> {
					if (isDigit(ch))
						yield readNumber(input);

					throw new ParseException(ParseError.unexpectedCharacter(ch, input.position()));
				}
			};

			tokens.add(token);
		}
	}

	/**
	 * Reads a string literal, quotes included. There are no escape sequences: the first {@code "} after the
	 * opening one always ends the literal.
	 */
	@Contract(mutates = "param")
	private static Token readString(CursorReader<Character> input) throws ParseException {
		var output = new StringBuilder().append('"');
		input.consume('"');

		char c;
		do {
			c = input.advance();
			output.append(c);
		} while (c != '"');

		return Token.string(output.toString());
	}

	/**
	 * Reads an unsigned decimal number with at most one decimal point.
	 * @return a {@link Double} if the text had a decimal point, otherwise the narrowest integer type that fits
	 */
	@Contract(mutates = "param")
	private static Token readNumber(CursorReader<Character> input) throws ParseException {
		var stringValueBuilder = new StringBuilder();
		var isFloat = false;

		Character c;
		while ((c = input.peek()) != null) {
			if (isDigit(c)) {
				stringValueBuilder.append(input.advance());
			} else if (c == '.') {
				if (isFloat)
					throw new ParseException(ParseError.invalidNumber(input.position()));

				isFloat = true;
				stringValueBuilder.append(input.advance());
			} else {
				break;
			}
		}

		String stringValue = stringValueBuilder.toString();
		if (isFloat)
			return Token.number(Double.parseDouble(stringValue));

		return Token.number(JerryValue.narrow(new BigInteger(stringValue)));
	}

	@Contract(mutates = "param")
	private static void skipWhitespace(CursorReader<Character> input) throws ParseException {
		Character c;
		while ((c = input.peek()) != null && isWhitespace(c)) {
			input.advance();
		}
	}

	/**
	 * Java whitespace plus the Unicode space separators (no-break spaces included) and NEL.
	 */
	private static boolean isWhitespace(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == 0x85;
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private JerryTokenizer() {
	}
}
