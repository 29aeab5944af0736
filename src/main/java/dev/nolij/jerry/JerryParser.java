package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link JerryValue} tree from the tokens produced by {@link JerryTokenizer}.
 */
public final class JerryParser {

	/**
	 * Whether <code>{}</code> is accepted as an empty object. When {@code false}, keys are strict: a string literal
	 * must follow every <code>{</code>, so <code>{}</code> fails with {@link ParseError.Kind#UNEXPECTED_VALUE} on the
	 * <code>}</code>.
	 */
	public boolean emptyObjects;

	public JerryParser() {
		this.emptyObjects = true;
	}

	/**
	 * Parses a whole document. The document must be a single object or array, and must use up every token.
	 * @param input a reader positioned at the first token
	 * @return the root value, or the error that stopped parsing
	 */
	@NotNull
	@Contract(mutates = "param")
	public ParseResult<JerryValue> parse(@NotNull CursorReader<Token> input) {
		try {
			return ParseResult.success(parseDocument(input));
		} catch (ParseException e) {
			return ParseResult.failure(e.error);
		}
	}

	private JerryValue parseDocument(CursorReader<Token> input) throws ParseException {
		Token token = input.peek();

		JerryValue root;
		if (Token.OPEN_BRACE.equals(token)) {
			root = parseObject(input);
		} else if (Token.OPEN_BRACKET.equals(token)) {
			root = parseArray(input);
		} else {
			throw new ParseException(ParseError.invalidRoot(token, input.position()));
		}

		Token trailing = input.peek();
		if (trailing != null)
			throw new ParseException(ParseError.trailingTokens(trailing, input.position()));

		return root;
	}

	@Contract(mutates = "param")
	private JerryValue parseValue(CursorReader<Token> input) throws ParseException {
		Token token = input.peek();
		if (token == null)
			throw new ParseException(ParseError.outOfBounds(input.position()));

		switch (token.kind) {
			case PUNCTUATION -> {
				if (token.equals(Token.OPEN_BRACE))
					return parseObject(input);
				if (token.equals(Token.OPEN_BRACKET))
					return parseArray(input);
			}
			case NUMBER -> {
				input.advance();
				return JerryValue.number(((Token.NumberLiteral) token).value);
			}
			case STRING -> {
				return JerryValue.string(parseString(input));
			}
		}

		throw new ParseException(ParseError.unexpectedValue(token, input.position()));
	}

	/**
	 * Parses an object. Keys must be string literals. A repeated key replaces the earlier value but keeps its place.
	 */
	@Contract(mutates = "param")
	private JerryValue parseObject(CursorReader<Token> input) throws ParseException {
		Map<String, JerryValue> map = new LinkedHashMap<>();
		input.consume(Token.OPEN_BRACE);

		if (!(emptyObjects && Token.CLOSE_BRACE.equals(input.peek()))) {
			while (true) {
				String key = parseString(input);
				input.consume(Token.COLON);
				map.put(key, parseValue(input));

				if (!Token.COMMA.equals(input.peek()))
					break;

				input.advance();
			}
		}

		input.consume(Token.CLOSE_BRACE);
		return JerryValue.object(map);
	}

	/**
	 * Parses an array. A comma right before the closing bracket is allowed.
	 */
	@Contract(mutates = "param")
	private JerryValue parseArray(CursorReader<Token> input) throws ParseException {
		List<JerryValue> list = new ArrayList<>();
		input.consume(Token.OPEN_BRACKET);

		while (!Token.CLOSE_BRACKET.equals(input.peek())) {
			list.add(parseValue(input));

			if (!Token.COMMA.equals(input.peek()))
				break;

			input.advance();
		}

		input.consume(Token.CLOSE_BRACKET);
		return JerryValue.array(list);
	}

	/**
	 * Reads a string literal token and strips its quotes.
	 */
	@Contract(mutates = "param")
	private static String parseString(CursorReader<Token> input) throws ParseException {
		int at = input.position();
		Token token = input.advance();
		if (!(token instanceof Token.StringLiteral literal))
			throw new ParseException(ParseError.unexpectedValue(token, at));

		return literal.contents();
	}

	@Contract(value = "_ -> this", mutates = "this")
	public JerryParser withEmptyObjects(boolean emptyObjects) {
		this.emptyObjects = emptyObjects;
		return this;
	}
}
