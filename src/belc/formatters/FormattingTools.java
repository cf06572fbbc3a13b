package belc.formatters;

import belc.model.graph.Concept;
import belc.model.term.IdentifierToken;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.regex.Pattern;

public class FormattingTools {

	private static final Pattern BARE_NAME = Pattern.compile("[A-Za-z0-9_]+");

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T param) throws IOException;
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(", ");
			}
			isFirst = false;
			writer.format(item);
		}
	}

	public static String quote(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}

	public static String quoteIfNeeded(String name) {
		return BARE_NAME.matcher(name).matches() ? name : quote(name);
	}

	/**
	 * Writes {@code NS:name}, or just the name for the built-in {@code bel} namespace.
	 */
	public static void writeConcept(Writer out, Concept concept) throws IOException {
		if(!IdentifierToken.BEL_NAMESPACE.equals(concept.getNamespace())) {
			out.write(concept.getNamespace());
			out.write(":");
		}
		out.write(quoteIfNeeded(concept.getName()));
	}
}
