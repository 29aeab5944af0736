package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of a parsed document. {@link #type} says which of the five shapes it has:
 * <ul>
 *     <li>{@link Type#OBJECT} - {@link #value} is a {@code Map<String, JerryValue>} in insertion order</li>
 *     <li>{@link Type#ARRAY} - {@link #value} is a {@code List<JerryValue>}</li>
 *     <li>{@link Type#STRING} - {@link #value} is a {@link String}</li>
 *     <li>{@link Type#INTEGER} - {@link #value} is an {@link Integer}, {@link Long} or {@link BigInteger}</li>
 *     <li>{@link Type#FLOAT} - {@link #value} is a {@link Double}</li>
 * </ul>
 * Containers are mutable so that callers can build documents in place.
 */
public final class JerryValue {

	public enum Type {
		OBJECT,
		ARRAY,
		STRING,
		INTEGER,
		FLOAT
	}

	@NotNull
	public final Type type;

	@NotNull
	public final Object value;

	private JerryValue(@NotNull Type type, @NotNull Object value) {
		this.type = type;
		this.value = value;
	}

	@NotNull
	@Contract("_ -> new")
	public static JerryValue object(@NotNull Map<String, JerryValue> members) {
		return new JerryValue(Type.OBJECT, Objects.requireNonNull(members, "members"));
	}

	@NotNull
	@Contract("_ -> new")
	public static JerryValue array(@NotNull List<JerryValue> elements) {
		return new JerryValue(Type.ARRAY, Objects.requireNonNull(elements, "elements"));
	}

	@NotNull
	@Contract("_ -> new")
	public static JerryValue string(@NotNull String value) {
		return new JerryValue(Type.STRING, Objects.requireNonNull(value, "value"));
	}

	/**
	 * Wraps a number. {@link Double}s and {@link Float}s become {@link Type#FLOAT}, everything else {@link Type#INTEGER}.
	 */
	@NotNull
	@Contract("_ -> new")
	public static JerryValue number(@NotNull Number value) {
		Number normalized = normalize(Objects.requireNonNull(value, "value"));
		return new JerryValue(normalized instanceof Double ? Type.FLOAT : Type.INTEGER, normalized);
	}

	/**
	 * Wraps a plain Java value: a {@link JerryValue} (returned as is), {@link Map}, {@link Iterable}, {@link String}
	 * or {@link Number}. Containers are converted recursively into new containers.
	 * @throws IllegalArgumentException for {@code null} and any other type
	 */
	@NotNull
	public static JerryValue of(Object value) {
		if (value instanceof JerryValue jerryValue) {
			return jerryValue;
		} else if (value instanceof Map<?, ?> map) {
			Map<String, JerryValue> members = new LinkedHashMap<>();
			for (var entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String key))
					throw new IllegalArgumentException("Object keys must be strings, got " + entry.getKey());

				members.put(key, of(entry.getValue()));
			}
			return object(members);
		} else if (value instanceof Iterable<?> iterable) {
			List<JerryValue> elements = new ArrayList<>();
			for (Object element : iterable) {
				elements.add(of(element));
			}
			return array(elements);
		} else if (value instanceof String stringValue) {
			return string(stringValue);
		} else if (value instanceof Number numberValue) {
			return number(numberValue);
		}

		throw new IllegalArgumentException("Unsupported value type: " + (value == null ? "null" : value.getClass().getName()));
	}

	@SuppressWarnings("unchecked")
	@NotNull
	public Map<String, JerryValue> asObject() {
		expect(Type.OBJECT);
		return (Map<String, JerryValue>) value;
	}

	@SuppressWarnings("unchecked")
	@NotNull
	public List<JerryValue> asArray() {
		expect(Type.ARRAY);
		return (List<JerryValue>) value;
	}

	@NotNull
	public String asString() {
		expect(Type.STRING);
		return (String) value;
	}

	/**
	 * @return the value of an {@link Type#INTEGER} or {@link Type#FLOAT}
	 */
	@NotNull
	public Number asNumber() {
		if (type != Type.INTEGER && type != Type.FLOAT)
			throw new IllegalStateException("Expected a number, got " + type);

		return (Number) value;
	}

	private void expect(Type expected) {
		if (type != expected)
			throw new IllegalStateException("Expected " + expected + ", got " + type);
	}

	/**
	 * Brings numbers into the forms documents use: floating-point values as {@link Double}, integers as the narrowest
	 * of {@link Integer}, {@link Long} and {@link BigInteger}.
	 */
	@NotNull
	static Number normalize(@NotNull Number number) {
		if (number instanceof Double || number instanceof Float)
			return number.doubleValue();

		BigInteger bigIntValue;
		if (number instanceof BigInteger big) {
			bigIntValue = big;
		} else if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
			bigIntValue = BigInteger.valueOf(number.longValue());
		} else {
			throw new IllegalArgumentException("Unsupported number type: " + number.getClass().getName());
		}

		return narrow(bigIntValue);
	}

	@NotNull
	static Number narrow(@NotNull BigInteger bigIntValue) {
		if (bigIntValue.bitLength() < Integer.SIZE)
			return bigIntValue.intValue();
		if (bigIntValue.bitLength() < Long.SIZE)
			return bigIntValue.longValue();

		return bigIntValue;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value);
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof JerryValue v && type == v.type && value.equals(v.value);
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> '"' + (String) value + '"';
			case OBJECT, ARRAY -> String.valueOf(value);
			default -> value.toString();
		};
	}

	/**
	 * @return an unmodifiable view of an object's keys in insertion order
	 */
	@NotNull
	public List<String> keys() {
		return Collections.unmodifiableList(new ArrayList<>(asObject().keySet()));
	}
}
