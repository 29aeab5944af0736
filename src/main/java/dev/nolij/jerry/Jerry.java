package dev.nolij.jerry;

import org.intellij.lang.annotations.Language;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points for reading documents, and helpers for building them.
 */
public final class Jerry {
	private static final Logger LOG = LoggerFactory.getLogger(Jerry.class);

	//region -------------------- Helper Methods --------------------

	/**
	 * Create a new entry with the given key and value. The value is converted with {@link JerryValue#of(Object)}.
	 */
	@NotNull
	@Contract(value = "_, _ -> new", pure = true)
	public static Map.Entry<String, JerryValue> entry(@NotNull String key, @NotNull Object value) {
		return new AbstractMap.SimpleEntry<>(key, JerryValue.of(value));
	}

	/**
	 * Create a new object with the given entries. Later entries replace earlier ones with the same key.
	 */
	@NotNull
	@SafeVarargs
	@Contract("_ -> new")
	public static JerryValue object(@NotNull Map.Entry<String, JerryValue>... entries) {
		Map<String, JerryValue> map = new LinkedHashMap<>();
		for (Map.Entry<String, JerryValue> e : entries) {
			map.put(e.getKey(), e.getValue());
		}
		return JerryValue.object(map);
	}

	/**
	 * Create a new array with the given values, each converted with {@link JerryValue#of(Object)}.
	 */
	@NotNull
	@Contract("_ -> new")
	public static JerryValue array(@NotNull Object... values) {
		List<JerryValue> list = new ArrayList<>(values.length);
		for (Object value : values) {
			list.add(JerryValue.of(value));
		}
		return JerryValue.array(list);
	}

	//endregion

	//region -------------------- Parser --------------------

	/**
	 * Splits the given text into tokens.
	 */
	@NotNull
	@Contract(pure = true)
	public static ParseResult<List<Token>> tokenize(@NotNull String text) {
		return JerryTokenizer.tokenize(CursorReader.ofChars(text));
	}

	/**
	 * Tokenizes and parses the given text with a default {@link JerryParser}.
	 */
	@NotNull
	@Contract(pure = true)
	public static ParseResult<JerryValue> parse(@NotNull String text) {
		return parse(text, new JerryParser());
	}

	/**
	 * Tokenizes the given text and, if that succeeded, parses the tokens with the given parser.
	 * A tokenizer error is returned as is and the parser never runs.
	 */
	@NotNull
	@Contract(pure = true)
	public static ParseResult<JerryValue> parse(@NotNull String text, @NotNull JerryParser parser) {
		ParseResult<List<Token>> tokens = tokenize(text);
		if (!tokens.isSuccess()) {
			LOG.debug("Tokenizing {} characters failed: {}", text.length(), tokens.getError());
			return ParseResult.failure(tokens.getError());
		}

		LOG.debug("Tokenized {} characters into {} tokens", text.length(), tokens.get().size());

		ParseResult<JerryValue> tree = parser.parse(new CursorReader<>(tokens.get()));
		if (!tree.isSuccess())
			LOG.debug("Parsing {} tokens failed: {}", tokens.get().size(), tree.getError());

		return tree;
	}

	/**
	 * Parses a document from the given {@link String}.
	 * @param serialized The document to parse
	 * @return the root object or array
	 * @throws ParseException if the text is not a valid document
	 */
	@NotNull
	@Contract(pure = true)
	public static JerryValue parseString(@NotNull @Language("json") String serialized) throws ParseException {
		return parse(serialized).orElseThrow();
	}

	/**
	 * Parses a document from the contents of the given {@link Path}, read as UTF-8.
	 * @param path The path to the file to parse
	 * @return see {@link #parseString(String)}
	 */
	@NotNull
	@Contract(pure = true)
	public static JerryValue parseFile(@NotNull Path path) throws IOException, ParseException {
		return parseFile(path, new JerryParser());
	}

	@NotNull
	@Contract(pure = true)
	public static JerryValue parseFile(@NotNull Path path, @NotNull JerryParser parser) throws IOException, ParseException {
		String text = Files.readString(path, StandardCharsets.UTF_8);
		LOG.debug("Read {} characters from {}", text.length(), path);
		return parse(text, parser).orElseThrow();
	}

	//endregion

	private Jerry() {
	}
}
