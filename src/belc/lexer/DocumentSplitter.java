package belc.lexer;

import belc.parser.BelMetadataParser;

import java.util.Collections;
import java.util.List;

/**
 * Splits the logical lines of a document into its definitions section, which runs up to and including the last
 * {@code SET DOCUMENT}, {@code DEFINE NAMESPACE} or {@code DEFINE ANNOTATION} line, and its statements section.
 */
public final class DocumentSplitter {

	private final List<LogicalLine> definitions;
	private final List<LogicalLine> statements;

	private DocumentSplitter(List<LogicalLine> definitions, List<LogicalLine> statements) {
		this.definitions = definitions;
		this.statements = statements;
	}

	public static DocumentSplitter split(List<LogicalLine> lines) {
		int end = 0;
		for(int i = 0; i < lines.size(); i++) {
			if(BelMetadataParser.isMetadataLine(lines.get(i).getText())) {
				end = i + 1;
			}
		}
		return new DocumentSplitter(
				Collections.unmodifiableList(lines.subList(0, end)),
				Collections.unmodifiableList(lines.subList(end, lines.size())));
	}

	public List<LogicalLine> getDefinitions() {
		return definitions;
	}

	public List<LogicalLine> getStatements() {
		return statements;
	}
}
