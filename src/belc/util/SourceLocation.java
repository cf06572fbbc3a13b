package belc.util;

import belc.formatters.IndentingWriter;

import java.io.IOException;

/**
 * A span of text within one logical BEL line. Lines are 1-based as in the source document, offsets are 0-based
 * character positions within the logical line text (start inclusive, end exclusive).
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final int line;
	private final int startOffset;
	private final int endOffset;

	public SourceLocation(int line, int startOffset, int endOffset) {
		this.line = line;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(-1, -1, -1);
	}

	public boolean isUnknown() {
		return line == -1 && startOffset == -1;
	}

	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		if(line != other.line) {
			throw new RuntimeException("Tried to combine source locations from two different lines: " + line + ", " + other.line);
		}
		return new SourceLocation(
				line,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset));
	}

	/**
	 * Writes a one-line description of this location followed by {@param lineText} and a row of carets under the
	 * characters this location covers.
	 */
	public void writePretty(IndentingWriter out, String lineText) throws IOException {
		if(isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at line " + line + ", column " + (startOffset + 1));
		if(lineText == null) {
			return;
		}
		out.newLine();
		out.write(lineText);
		out.newLine();
		for(int pos = 0; pos < startOffset; pos++) {
			out.append(' ');
		}
		int effectiveEnd = endOffset > startOffset ? endOffset : startOffset + 1;
		for(int pos = startOffset; pos < effectiveEnd && pos < lineText.length(); pos++) {
			out.append('^');
		}
		if(startOffset >= lineText.length()) {
			out.append("^ end of line");
		}
	}

	public int getLine() {
		return line;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + line;
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return line == other.line && startOffset == other.startOffset && endOffset == other.endOffset;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [line=" + line + ", startOffset=" + startOffset + ", endOffset=" + endOffset + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		int comparedStart = Integer.compare(startOffset, o.startOffset);
		if (comparedStart != 0) {
			return comparedStart;
		}
		return Integer.compare(endOffset, o.endOffset);
	}
}
