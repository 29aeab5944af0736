package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes {@link JerryValue}s as standard JSON.
 */
public final class JerryWriter {

	public String indent;
	public boolean expandArrays; // whether to put each array element on its own line
	public boolean escapeUnicode; // whether to write DEL and non-ASCII characters as \\u escapes

	public JerryWriter() {
		this.indent = "  ";
		this.expandArrays = true;
		this.escapeUnicode = true;
	}

	/**
	 * Converts the given value to a JSON string.
	 * @param data The value to convert.
	 * @return The JSON string.
	 */
	@NotNull
	public String stringify(@NotNull JerryValue data) {
		StringWriter output = new StringWriter();

		try {
			write(data, output);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}

		return output.toString();
	}

	/**
	 * Writes the given value in JSON format to the given file, as UTF-8.
	 * @param data The value to write.
	 * @param path The file to write to.
	 * @throws IOException If an I/O error occurs.
	 */
	@Contract(mutates = "param2")
	public void write(@NotNull JerryValue data, @NotNull Path path) throws IOException {
		try (Writer output = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(data, output);
			output.flush();
		}
	}

	/**
	 * Writes the given value in JSON format to the given output. No trailing newline is written.
	 * @param data The value to write.
	 * @param output The output to write to.
	 * @throws IOException If an I/O error occurs.
	 */
	@Contract(mutates = "param2")
	public void write(@NotNull JerryValue data, @NotNull Appendable output) throws IOException {
		write(data, output, "");
	}

	private void write(JerryValue data, Appendable output, String currentIndent) throws IOException {
		switch (data.type) {
			case OBJECT -> writeObject(data.asObject(), output, currentIndent);
			case ARRAY -> writeArray(data.asArray(), output, currentIndent);
			case STRING -> writeString(data.asString(), output);
			case INTEGER -> output.append(data.asNumber().toString());
			case FLOAT -> output.append(formatFloat(data.asNumber().doubleValue()));
		}
	}

	private void writeObject(Map<String, JerryValue> members, Appendable output, String currentIndent) throws IOException {
		if (members.isEmpty()) {
			output.append("{}");
			return;
		}

		String inner = currentIndent + indent;
		output.append("{\n");

		Iterator<Map.Entry<String, JerryValue>> iterator = members.entrySet().iterator();
		while (iterator.hasNext()) {
			var entry = iterator.next();
			output.append(inner);
			writeString(entry.getKey(), output);
			output.append(": ");
			write(entry.getValue(), output, inner);
			if (iterator.hasNext())
				output.append(',');
			output.append('\n');
		}

		output.append(currentIndent).append('}');
	}

	private void writeArray(List<JerryValue> elements, Appendable output, String currentIndent) throws IOException {
		if (elements.isEmpty()) {
			output.append("[]");
			return;
		}

		String inner = currentIndent + indent;
		output.append('[');

		for (int i = 0; i < elements.size(); i++) {
			if (i > 0)
				output.append(expandArrays ? "," : ", ");
			if (expandArrays)
				output.append('\n').append(inner);

			write(elements.get(i), output, inner);
		}

		if (expandArrays)
			output.append('\n').append(currentIndent);

		output.append(']');
	}

	private void writeString(String value, Appendable output) throws IOException {
		output.append('"').append(escape(value, escapeUnicode)).append('"');
	}

	/**
	 * Escapes a string for use inside a JSON string literal. The following characters are escaped:
	 * <ul>
	 *     <li>Quote and backslash: {@code \"}, {@code \\}</li>
	 *     <li>Control characters with a short form: {@code \b}, {@code \f}, {@code \n}, {@code \r}, {@code \t}</li>
	 *     <li>Other control characters, and every character above {@code 0x7e} if {@code escapeUnicode} is set, as {@code \}{@code uXXXX}</li>
	 * </ul>
	 */
	@NotNull
	@Contract(pure = true)
	public static String escape(@NotNull String string, boolean escapeUnicode) {
		final StringBuilder result = new StringBuilder(string.length());
		for (int i = 0; i < string.length(); i++) {
			final char c = string.charAt(i);
			switch (c) {
				case '"' -> result.append("\\\"");
				case '\\' -> result.append("\\\\");
				case '\b' -> result.append("\\b");
				case '\f' -> result.append("\\f");
				case '\n' -> result.append("\\n");
				case '\r' -> result.append("\\r");
				case '\t' -> result.append("\\t");
				default -> {
					if (c < 0x20 || (escapeUnicode && c > 0x7e)) {
						result.append(String.format("\\u%04x", (int) c));
					} else {
						result.append(c);
					}
				}
			}
		}

		return result.toString();
	}

	/**
	 * Formats a double the way Python's {@code repr} does: shortest round-trip digits, positional notation for
	 * decimal exponents from -4 up to 15, scientific notation ({@code 1e+16}, {@code 1.5e-05}) outside that.
	 */
	@NotNull
	@Contract(pure = true)
	public static String formatFloat(double value) {
		if (Double.isNaN(value))
			return "NaN";
		if (Double.isInfinite(value))
			return value > 0 ? "Infinity" : "-Infinity";
		if (value == 0)
			return (1 / value < 0) ? "-0.0" : "0.0";

		BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
		int exponent = decimal.precision() - decimal.scale() - 1;

		if (exponent >= -4 && exponent < 16) {
			String plain = decimal.toPlainString();
			return plain.indexOf('.') < 0 ? plain + ".0" : plain;
		}

		String digits = decimal.unscaledValue().abs().toString();
		StringBuilder output = new StringBuilder();
		if (decimal.signum() < 0)
			output.append('-');
		output.append(digits.charAt(0));
		if (digits.length() > 1)
			output.append('.').append(digits, 1, digits.length());

		output.append('e').append(exponent < 0 ? '-' : '+');
		int magnitude = Math.abs(exponent);
		if (magnitude < 10)
			output.append('0');

		return output.append(magnitude).toString();
	}

	@Contract(value = "_ -> this", mutates = "this")
	public JerryWriter withIndent(String indent) {
		this.indent = indent;
		return this;
	}

	@Contract(value = "_ -> this", mutates = "this")
	public JerryWriter withExpandArrays(boolean expandArrays) {
		this.expandArrays = expandArrays;
		return this;
	}

	@Contract(value = "_ -> this", mutates = "this")
	public JerryWriter withEscapeUnicode(boolean escapeUnicode) {
		this.escapeUnicode = escapeUnicode;
		return this;
	}
}
