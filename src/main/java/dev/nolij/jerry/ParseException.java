package dev.nolij.jerry;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a document cannot be tokenized or parsed. Carries the {@link ParseError} that describes the failure.
 */
public final class ParseException extends Exception {

	@NotNull
	public final ParseError error;

	public ParseException(@NotNull ParseError error) {
		super(error.message);
		this.error = error;
	}
}
