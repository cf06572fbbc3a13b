package belc.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that indents every line after a newline by the current indentation level. Indentation is pushed with
 * {@link #indent()} and popped by closing the returned {@link Indent}.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}
	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	private void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent) {
				for(int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			int next = data.indexOf(LF, start);
			if(next == -1) {
				out.write(data, start, data.length() - start);
				break;
			}
			out.write(data, start, next + LF.length() - start);
			start = next + LF.length();
			shouldIndent = true;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
