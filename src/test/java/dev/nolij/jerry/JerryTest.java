package dev.nolij.jerry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static dev.nolij.jerry.Jerry.*;
import static org.junit.jupiter.api.Assertions.*;

public class JerryTest {

	static Path resource(String name) throws URISyntaxException {
		return Path.of(JerryTest.class.getResource("/documents/" + name).toURI());
	}

	private static ParseError error(String text) {
		ParseResult<JerryValue> result = parse(text);
		assertFalse(result.isSuccess(), () -> "expected a failure, got " + result);
		return result.getError();
	}

	@Test
	public void numberArray() throws ParseException {
		JerryValue value = parseString("[1, 2.5, 3]");

		assertEquals(array(1, 2.5, 3), value);
		assertEquals(List.of(JerryValue.Type.INTEGER, JerryValue.Type.FLOAT, JerryValue.Type.INTEGER),
			value.asArray().stream().map(v -> v.type).toList());
	}

	@Test
	public void nestedDocument() throws ParseException {
		String json = """
		{
			"arr": [1, 2, 3],
			"obj": {
				"a": 1,
				"b": "2",
				"c": {
					"d": 3.0,
					"e": [4, 5, 6]
				}
			},
			"str": "hello",
			"num": 42
		}
		""";

		assertEquals(object(
			entry("arr", array(1, 2, 3)),
			entry("obj", object(
				entry("a", 1),
				entry("b", "2"),
				entry("c", object(
					entry("d", 3.0),
					entry("e", array(4, 5, 6))
				))
			)),
			entry("str", "hello"),
			entry("num", 42)
		), parseString(json));
	}

	@Test
	public void funkyFormatting() throws ParseException {
		String json = """
		{"hmm":   "yes",
											"list":[1,2,[3]],"o":{"k":"v"}}""";

		assertEquals(object(
			entry("hmm", "yes"),
			entry("list", array(1, 2, array(3))),
			entry("o", object(entry("k", "v")))
		), parseString(json));
	}

	@Test
	public void noBreakSpacesBetweenTokens() throws ParseException {
		assertEquals(array(1, 2), parseString("[1,\u00a02]"));
		assertEquals(object(entry("a", 1)), parseString("{\u0085\"a\":\u00a01}"));
	}

	@Test
	public void lastDuplicateKeyWins() throws ParseException {
		JerryValue value = parseString("{\"a\":1,\"a\":2}");

		assertEquals(object(entry("a", 2)), value);
		assertEquals(1, value.asObject().size());
	}

	@Test
	public void emptyContainers() throws ParseException {
		assertEquals(array(), parseString("[]"));
		assertEquals(object(), parseString("{}"));
		assertEquals(object(entry("a", object()), entry("b", array())), parseString("{\"a\": {}, \"b\": []}"));
	}

	@Test
	public void emptyObjectsCanBeRejected() {
		ParseResult<JerryValue> result = parse("{}", new JerryParser().withEmptyObjects(false));

		assertFalse(result.isSuccess());
		assertEquals(ParseError.Kind.UNEXPECTED_VALUE, result.getError().kind);
	}

	@Test
	public void stringsAreRaw() throws ParseException {
		JerryValue value = parseString("[\"C:\\\\path\\n\", \"line\nbreak\", \"\"]");

		assertEquals(array("C:\\\\path\\n", "line\nbreak", ""), value);
	}

	@Test
	public void unterminatedString() {
		assertEquals(ParseError.Kind.OUT_OF_BOUNDS, error("\"abc").kind);
		assertEquals(ParseError.Kind.OUT_OF_BOUNDS, error("[\"abc").kind);
	}

	@Test
	public void invalidNumber() {
		ParseError error = error("[1.2.3]");

		assertEquals(ParseError.Kind.INVALID_NUMBER, error.kind);
		assertEquals(4, error.position);
	}

	@Test
	public void trailingTokens() {
		ParseError error = error("[1]2");

		assertEquals(ParseError.Kind.TRAILING_TOKENS, error.kind);
		assertEquals(Token.number(2), error.actual);
	}

	@Test
	public void scalarRoot() {
		assertEquals(ParseError.Kind.INVALID_ROOT, error("5").kind);
		assertEquals(ParseError.Kind.INVALID_ROOT, error("\"str\"").kind);
		assertEquals(ParseError.Kind.INVALID_ROOT, error("").kind);
	}

	@Test
	public void unquotedKey() {
		ParseException e = assertThrows(ParseException.class, () -> parseString("{a:1}"));

		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, e.error.kind);
		assertEquals('a', e.error.actual);
		assertEquals(1, e.error.position);
	}

	@Test
	public void tokenizerErrorsWinOverParserErrors() {
		// a scalar root would also be rejected by the parser, but tokenizing fails first
		assertEquals(ParseError.Kind.UNEXPECTED_CHARACTER, error("5 x").kind);
	}

	@Test
	public void parsingIsDeterministic() {
		String json = "{\"b\": [1, 2.0, \"three\"], \"a\": {}}";

		assertEquals(parse(json), parse(json));
		assertEquals(parse("[1,,]"), parse("[1,,]"));
	}

	@Test
	public void insertionOrderIsKept() throws ParseException {
		JerryValue value = parseString("{\"z\": 1, \"a\": 2, \"m\": 3, \"a\": 4}");

		assertEquals(List.of("z", "a", "m"), value.keys());
		assertEquals(JerryValue.number(4), value.asObject().get("a"));
	}

	@Test
	public void parseFileFromResources() throws Exception {
		JerryValue value = parseFile(resource("people.json"));

		Map<String, JerryValue> members = value.asObject();
		assertEquals("Tom", members.get("name").asString());
		assertEquals(42, members.get("age").asNumber());
		assertEquals(1.8, members.get("height").asNumber());
		assertEquals(array("mouse", "cartoon"), members.get("tags"));
		assertEquals(List.of("name", "age", "height", "tags", "empty", "address", "nested"), value.keys());
	}

	@Test
	public void parseFileRoundTripsThroughWriter(@TempDir Path dir) throws Exception {
		JerryValue value = parseFile(resource("people.json"));
		String expected = Files.readString(resource("people.expected.json"), StandardCharsets.UTF_8).stripTrailing();

		assertEquals(expected, new JerryWriter().stringify(value));

		Path copy = dir.resolve("copy.json");
		new JerryWriter().write(value, copy);
		assertEquals(value, parseFile(copy));
	}

	@Test
	public void parseMissingFile(@TempDir Path dir) {
		assertThrows(NoSuchFileException.class, () -> parseFile(dir.resolve("missing.json")));
	}

	@Test
	public void parseFileWithError(@TempDir Path dir) throws IOException {
		Path path = dir.resolve("bad.json");
		Files.writeString(path, "{\"a\": 1", StandardCharsets.UTF_8);

		ParseException e = assertThrows(ParseException.class, () -> parseFile(path));
		assertEquals(ParseError.Kind.OUT_OF_BOUNDS, e.error.kind);
	}

	@Test
	public void tokenizeFacade() {
		assertEquals(List.of(Token.OPEN_BRACKET, Token.string("\"x\""), Token.CLOSE_BRACKET), tokenize("[\"x\"]").get());
	}
}
