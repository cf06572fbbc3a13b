package belc.parser;

import belc.Unreachable;
import belc.formatters.IndentingWriter;
import belc.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Thrown when no valid parse of a BEL line exists. Only the failures at the furthest position reached are reported,
 * since those are almost always the ones pointing at the actual mistake.
 */
@SuppressWarnings("serial")
public class ParseFailureException extends Exception {
	private final String text;
	private final NavigableMap<SourceLocation, Set<ParseFailure>> reason;

	private static String getReasonString(String text, NavigableMap<SourceLocation, Set<ParseFailure>> map) {
		if(map.isEmpty()) {
			return "Parse failure";
		}
		Map.Entry<SourceLocation, Set<ParseFailure>> e = map.lastEntry();
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			out.write("Parse failure ");
			e.getKey().writePretty(out, text);
			try(IndentingWriter.Indent ignored = out.indent()){
				for(ParseFailure f : e.getValue()) {
					out.newLine();
					out.write(f.toString());
				}
			}
		} catch (IOException e1) {
			throw new Unreachable(e1);
		}
		return w.toString();
	}

	public ParseFailureException(String text, NavigableMap<SourceLocation, Set<ParseFailure>> reason) {
		super(getReasonString(text, reason));
		this.text = text;
		this.reason = reason;
	}

	public String getText() {
		return text;
	}

	public NavigableMap<SourceLocation, Set<ParseFailure>> getReason() {
		return reason;
	}

	/**
	 * @return the location of the furthest failures, or an unknown location if nothing was recorded
	 */
	public SourceLocation getFurthestLocation() {
		return reason.isEmpty() ? SourceLocation.unknown() : reason.lastKey();
	}

	public Set<ParseFailure> getFurthestFailures() {
		return reason.isEmpty() ? Collections.emptySet() : reason.lastEntry().getValue();
	}
}
