package dev.nolij.jerry;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JerryTokenizerTest {

	private static List<Token> tokens(String text) {
		ParseResult<List<Token>> result = JerryTokenizer.tokenize(CursorReader.ofChars(text));
		assertTrue(result.isSuccess(), () -> "tokenizing failed: " + result.getError());
		return result.get();
	}

	private static ParseError error(String text) {
		ParseResult<List<Token>> result = JerryTokenizer.tokenize(CursorReader.ofChars(text));
		assertFalse(result.isSuccess(), () -> "expected a failure, got " + result);
		return result.getError();
	}

	@Test
	public void punctuationAndWhitespace() {
		assertEquals(List.of(
			Token.OPEN_BRACE, Token.CLOSE_BRACE, Token.OPEN_BRACKET,
			Token.CLOSE_BRACKET, Token.COLON, Token.COMMA
		), tokens(" {\t}\n[\r\n] :  , "));
	}

	@Test
	public void emptyInput() {
		assertEquals(List.of(), tokens(""));
		assertEquals(List.of(), tokens(" \n\t "));
	}

	@Test
	public void unicodeSpacesSeparateTokens() {
		List<Token> expected = List.of(Token.OPEN_BRACKET, Token.number(1), Token.COMMA, Token.number(2), Token.CLOSE_BRACKET);

		assertEquals(expected, tokens("[1,\u00a02]")); // no-break space
		assertEquals(expected, tokens("[1,\u00852]")); // next line
		assertEquals(expected, tokens("[1,\u20072]")); // figure space
		assertEquals(expected, tokens("[1,\u202f2]")); // narrow no-break space
		assertEquals(expected, tokens("\u3000[1,  2]\u00a0"));
	}

	@Test
	public void onlyAsciiDigitsStartNumbers() {
		ParseError error = error("[\u0663]"); // arabic-indic three

		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error.kind);
		assertEquals('\u0663', error.actual);
		assertEquals(1, error.position);
	}

	@Test
	public void stringsKeepTheirQuotes() {
		List<Token> tokens = tokens("\"hello world\" \"\"");

		assertEquals(List.of(Token.string("\"hello world\""), Token.string("\"\"")), tokens);
		assertEquals("hello world", ((Token.StringLiteral) tokens.get(0)).contents());
	}

	@Test
	public void stringsMayContainPunctuationAndNewlines() {
		assertEquals(List.of(Token.string("\"{a: [1, 2]}\nnext\"")), tokens("\"{a: [1, 2]}\nnext\""));
	}

	@Test
	public void backslashDoesNotEscapeQuote() {
		// "a\"b" ends after the backslash; the b that follows cannot start a token
		ParseError error = error("\"a\\\"b\"");

		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error.kind);
		assertEquals('b', error.actual);
		assertEquals(4, error.position);

		assertEquals(List.of(Token.string("\"a\\\"")), tokens("\"a\\\""));
	}

	@Test
	public void unterminatedString() {
		ParseError error = error("[\"abc");

		assertEquals(ParseError.Kind.OUT_OF_BOUNDS, error.kind);
		assertEquals(5, error.position);
	}

	@Test
	public void numbers() {
		List<Token> tokens = tokens("0 42 2.5 7. 007 3.25");

		assertEquals(List.of(
			Token.number(0), Token.number(42), Token.number(2.5),
			Token.number(7.0), Token.number(7), Token.number(3.25)
		), tokens);
		assertFalse(((Token.NumberLiteral) tokens.get(1)).isFloat());
		assertTrue(((Token.NumberLiteral) tokens.get(2)).isFloat());
	}

	@Test
	public void numbersEndAtPunctuation() {
		assertEquals(List.of(
			Token.OPEN_BRACKET, Token.number(1), Token.COMMA, Token.number(2.5), Token.CLOSE_BRACKET
		), tokens("[1,2.5]"));
	}

	@Test
	public void numberAtEndOfInput() {
		assertEquals(List.of(Token.number(5)), tokens("5"));
	}

	@Test
	public void integersWidenToFit() {
		List<Token> tokens = tokens("2147483647 2147483648 9223372036854775808");

		assertEquals(Integer.MAX_VALUE, ((Token.NumberLiteral) tokens.get(0)).value);
		assertEquals(2147483648L, ((Token.NumberLiteral) tokens.get(1)).value);
		assertEquals(new BigInteger("9223372036854775808"), ((Token.NumberLiteral) tokens.get(2)).value);
	}

	@Test
	public void secondDecimalPoint() {
		ParseError error = error("1.2.3");

		assertEquals(ParseError.Kind.INVALID_NUMBER, error.kind);
		assertEquals(3, error.position);
	}

	@Test
	public void unexpectedCharacter() {
		ParseError error = error("{a:1}");

		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error.kind);
		assertEquals('a', error.actual);
		assertEquals(1, error.position);
		assertEquals("Unexpected char 'a' at index 1", error.message);
	}

	@Test
	public void unsupportedLiterals() {
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("[true]").kind);
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("[null]").kind);
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("[-1]").kind);
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("[.5]").kind);
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("[1e5]").kind);
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("// comment").kind);
	}

	@Test
	public void failureReturnsNoTokens() {
		ParseResult<List<Token>> result = JerryTokenizer.tokenize(CursorReader.ofChars("[1, 2, x]"));

		assertFalse(result.isSuccess());
		assertThrows(IllegalStateException.class, result::get);
		assertThrows(ParseException.class, result::orElseThrow);
	}
}
