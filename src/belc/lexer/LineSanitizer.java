package belc.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the physical lines of a BEL document into logical lines.
 *
 * Blank lines and {@code #} comment lines are dropped and a trailing {@code //} comment is cut off. A line ending in
 * a backslash continues on the next line; so does a line that opens a quote without closing it, until some later
 * line closes the quote. Joined lines are separated by a single space.
 */
public class LineSanitizer {

	private static final Logger logger = Logger.getLogger("LineSanitizer");

	private static final String TRAILING_COMMENT = " //";

	private final List<String> lines;

	public LineSanitizer(List<String> lines) {
		this.lines = lines;
	}

	private static boolean hasOpenQuote(String text) {
		boolean open = false;
		for(int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if(c == '\\' && open) {
				i++;
			} else if(c == '"') {
				open = !open;
			}
		}
		return open;
	}

	/**
	 * Cuts the last {@code " //"} that is not inside a quoted string, and everything after it.
	 */
	static String stripTrailingComment(String text) {
		int from = text.length();
		while(true) {
			int index = text.lastIndexOf(TRAILING_COMMENT, from - 1);
			if(index < 0) {
				return text;
			}
			if(!hasOpenQuote(text.substring(0, index))) {
				return text.substring(0, index).trim();
			}
			from = index;
		}
	}

	private static boolean endsWithContinuation(String text) {
		return text.endsWith("\\") && !text.endsWith("\\\\");
	}

	public List<LogicalLine> readLines() {
		List<LogicalLine> result = new ArrayList<>();
		StringBuilder pending = null;
		int pendingNumber = 0;
		int lineNumber = 0;
		for(String raw : lines) {
			++lineNumber;
			String line = raw.trim();
			if(pending == null) {
				if(line.isEmpty() || line.startsWith("#")) {
					continue;
				}
				pending = new StringBuilder();
				pendingNumber = lineNumber;
			} else if(!line.isEmpty()) {
				pending.append(' ');
			}
			if(endsWithContinuation(line)) {
				pending.append(line, 0, line.length() - 1);
				// strip what precedes the backslash so that joins stay single-spaced
				int end = pending.length();
				while(end > 0 && Character.isWhitespace(pending.charAt(end - 1))) {
					end--;
				}
				pending.setLength(end);
				continue;
			}
			pending.append(line);
			if(hasOpenQuote(pending.toString())) {
				logger.fine("line " + pendingNumber + ": quote continues on line " + (lineNumber + 1));
				continue;
			}
			result.add(new LogicalLine(pendingNumber, stripTrailingComment(pending.toString())));
			pending = null;
		}
		if(pending != null) {
			logger.warning("line " + pendingNumber + ": document ends inside a continued line");
			result.add(new LogicalLine(pendingNumber, stripTrailingComment(pending.toString())));
		}
		return result;
	}
}
