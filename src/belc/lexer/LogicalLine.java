package belc.lexer;

import java.util.Objects;

/**
 * One statement of a BEL document after sanitizing: possibly several physical lines joined together, numbered by
 * the first of them.
 */
public final class LogicalLine {

	private final int lineNumber;
	private final String text;

	public LogicalLine(int lineNumber, String text) {
		this.lineNumber = lineNumber;
		this.text = text;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		LogicalLine that = (LogicalLine) o;
		return lineNumber == that.lineNumber && text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lineNumber, text);
	}

	@Override
	public String toString() {
		return lineNumber + ": " + text;
	}
}
