package dev.nolij.jerry;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * A forward-only reader over a fixed-length sequence. The position only ever moves forward, one element at a time.
 * @param <T> the element type
 */
public final class CursorReader<T> {

	private final List<? extends T> data;
	private final int length;
	private int position;

	public CursorReader(@NotNull List<? extends T> data) {
		this.data = Objects.requireNonNull(data, "data");
		this.length = data.size();
		this.position = 0;
	}

	/**
	 * Creates a reader over the characters of the given text, without copying it.
	 */
	@NotNull
	@Contract("_ -> new")
	public static CursorReader<Character> ofChars(@NotNull CharSequence text) {
		Objects.requireNonNull(text, "text");
		return new CursorReader<>(new CharacterList(text));
	}

	/**
	 * @return the element at the current position, or {@code null} if the reader is exhausted
	 */
	@Nullable
	@Contract(pure = true)
	public T peek() {
		if (position >= length)
			return null;

		return data.get(position);
	}

	/**
	 * Returns the element at the current position and moves past it.
	 * @throws ParseException with {@link ParseError.Kind#OUT_OF_BOUNDS} if the reader is exhausted.
	 * The position does not change in that case.
	 */
	@Contract(mutates = "this")
	public T advance() throws ParseException {
		if (position >= length)
			throw new ParseException(ParseError.outOfBounds(position));

		return data.get(position++);
	}

	/**
	 * Advances and checks that the element read equals {@code expected}.
	 * @throws ParseException with {@link ParseError.Kind#MISMATCHED_EXPECTATION} if it does not,
	 * or {@link ParseError.Kind#OUT_OF_BOUNDS} if the reader is exhausted
	 */
	@Contract(mutates = "this")
	public void consume(@NotNull T expected) throws ParseException {
		int at = position;
		T actual = advance();
		if (!expected.equals(actual))
			throw new ParseException(ParseError.mismatchedExpectation(expected, actual, at));
	}

	@Contract(pure = true)
	public int position() {
		return position;
	}

	@Contract(pure = true)
	public int length() {
		return length;
	}

	@Contract(pure = true)
	public boolean isExhausted() {
		return position >= length;
	}

	private static final class CharacterList extends AbstractList<Character> implements RandomAccess {
		private final CharSequence text;

		private CharacterList(CharSequence text) {
			this.text = text;
		}

		@Override
		public Character get(int index) {
			return text.charAt(index);
		}

		@Override
		public int size() {
			return text.length();
		}
	}
}
