package io.evitadb.lingua.po;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * Exception thrown when a PO catalog cannot be parsed.
 * Carries the line number where the malformed input was found.
 */
public final class PoParseException extends IOException {

	private final int lineNumber;

	/**
	 * Creates a new PoParseException.
	 *
	 * @param message    the error message describing the parsing failure
	 * @param lineNumber the line number where the error occurred (1-based)
	 */
	public PoParseException(@Nonnull String message, int lineNumber) {
		super(lineNumber > 0 ? message + " at line " + lineNumber : message);
		this.lineNumber = lineNumber;
	}

	/**
	 * Returns the line number where the parsing error occurred.
	 *
	 * @return line number (1-based), or 0 if unknown
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}
}
