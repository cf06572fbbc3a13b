package belc.trans;

import belc.errors.IssueContext;
import belc.model.control.ControlCommand;
import belc.model.control.ControlCommandVisitor;
import belc.model.control.SetCommand;
import belc.model.control.UnsetCommand;
import belc.model.graph.Citation;
import belc.oracle.NamespaceOracle;
import belc.oracle.OracleException;
import belc.parser.BelControlParser;
import belc.parser.LexicalContext;
import belc.parser.ParseFailureException;
import belc.util.SourceLocation;
import com.google.common.collect.ImmutableSet;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Tracks the citation, evidence, statement group and annotations that apply to the statements following the
 * {@code SET} and {@code UNSET} lines of a document.
 *
 * The parser is in one of two states. While bare, each line is a whole control command. When a {@code SET Evidence}
 * line opens a quote it does not close, the parser accumulates the following raw lines until one closes it, and
 * only then executes the command.
 */
public class ControlParser {

	private static final Logger logger = Logger.getLogger("ControlParser");

	public static final String CITATION = "Citation";
	public static final String EVIDENCE = "Evidence";
	public static final String SUPPORTING_TEXT = "SupportingText";
	public static final String STATEMENT_GROUP = "STATEMENT_GROUP";

	public static final String CITATION_TYPE_PUBMED = "PubMed";
	public static final Set<String> CITATION_TYPES = ImmutableSet.of(
			"Book", CITATION_TYPE_PUBMED, "Journal", "Online Resource", "URL", "DOI", "Other");

	// keys of currentAnnotations()
	public static final String CITATION_TYPE_KEY = "citation_type";
	public static final String CITATION_REFERENCE_KEY = "citation_reference";
	public static final String CITATION_NAME_KEY = "citation_name";
	public static final String CITATION_DATE_KEY = "citation_date";
	public static final String CITATION_AUTHORS_KEY = "citation_authors";
	public static final String CITATION_COMMENTS_KEY = "citation_comments";
	public static final String EVIDENCE_KEY = "evidence";
	public static final String STATEMENT_GROUP_KEY = "statement_group";

	private static final String AUTHOR_SEPARATOR = "|";

	private enum State {
		BARE,
		ACCUMULATING_EVIDENCE,
	}

	private final NamespaceOracle oracle;
	private final boolean requireCitation;

	private State state = State.BARE;
	private final StringBuilder accumulated = new StringBuilder();
	private int accumulatedLineNumber;

	private Citation citation;
	private String evidence;
	private String statementGroup;
	private final Map<String, Set<String>> annotations = new LinkedHashMap<>();

	public ControlParser(NamespaceOracle oracle, boolean requireCitation) {
		this.oracle = oracle;
		this.requireCitation = requireCitation;
	}

	public boolean isAccumulating() {
		return state == State.ACCUMULATING_EVIDENCE;
	}

	public Citation getCitation() {
		return citation;
	}

	public String getEvidence() {
		return evidence;
	}

	public String getStatementGroup() {
		return statementGroup;
	}

	/**
	 * @return the annotations currently set, in the order they were set
	 */
	public Map<String, Set<String>> getAnnotations() {
		return Collections.unmodifiableMap(annotations);
	}

	/**
	 * A snapshot of the whole context: citation fields, evidence, statement group and then the annotations, each
	 * as a set of values.
	 */
	public Map<String, Set<String>> currentAnnotations() {
		Map<String, Set<String>> result = new LinkedHashMap<>();
		if(citation != null) {
			result.put(CITATION_TYPE_KEY, Collections.singleton(citation.getType()));
			result.put(CITATION_REFERENCE_KEY, Collections.singleton(citation.getReference()));
			if(citation.getName() != null) {
				result.put(CITATION_NAME_KEY, Collections.singleton(citation.getName()));
			}
			if(citation.getDate() != null) {
				result.put(CITATION_DATE_KEY, Collections.singleton(citation.getDate()));
			}
			if(!citation.getAuthors().isEmpty()) {
				result.put(CITATION_AUTHORS_KEY, new LinkedHashSet<>(citation.getAuthors()));
			}
			if(citation.getComments() != null) {
				result.put(CITATION_COMMENTS_KEY, Collections.singleton(citation.getComments()));
			}
		}
		if(evidence != null) {
			result.put(EVIDENCE_KEY, Collections.singleton(evidence));
		}
		if(statementGroup != null) {
			result.put(STATEMENT_GROUP_KEY, Collections.singleton(statementGroup));
		}
		for(Map.Entry<String, Set<String>> entry : annotations.entrySet()) {
			result.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}
		return result;
	}

	public void clear() {
		clearCitation();
		statementGroup = null;
	}

	private void clearCitation() {
		citation = null;
		evidence = null;
		annotations.clear();
	}

	private static int countUnescapedQuotes(String line) {
		int count = 0;
		for(int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if(c == '\\') {
				i++;
			} else if(c == '"') {
				count++;
			}
		}
		return count;
	}

	private static boolean opensEvidence(String line) {
		return line.matches("SET\\s+(" + EVIDENCE + "|" + SUPPORTING_TEXT + ")\\s*=.*") &&
				countUnescapedQuotes(line) % 2 == 1;
	}

	private static String stripContinuation(String line) {
		return line.endsWith("\\") ? line.substring(0, line.length() - 1).trim() : line;
	}

	/**
	 * Handles one line of the statements section that is either a control command or, while accumulating, part of
	 * one.
	 */
	public void processLine(IssueContext ctx, int lineNumber, String line) {
		String trimmed = line.trim();
		if(state == State.ACCUMULATING_EVIDENCE) {
			accumulated.append(' ').append(stripContinuation(trimmed));
			if(countUnescapedQuotes(accumulated.toString()) % 2 == 0) {
				state = State.BARE;
				String command = accumulated.toString();
				accumulated.setLength(0);
				processCommandText(ctx, accumulatedLineNumber, command);
			}
			return;
		}
		if(opensEvidence(trimmed)) {
			logger.fine("line " + lineNumber + ": evidence continues on following lines");
			state = State.ACCUMULATING_EVIDENCE;
			accumulatedLineNumber = lineNumber;
			accumulated.append(stripContinuation(trimmed));
			return;
		}
		processCommandText(ctx, lineNumber, trimmed);
	}

	private void processCommandText(IssueContext ctx, int lineNumber, String text) {
		ControlCommand command;
		try {
			command = BelControlParser.readControlCommand(new LexicalContext(lineNumber, text));
		} catch (ParseFailureException e) {
			ctx.report(new GrammarIssue("control", e));
			return;
		}
		process(ctx, command);
	}

	public void process(IssueContext ctx, ControlCommand command) {
		command.accept(new CommandExecutor(ctx));
	}

	private static boolean isValidDate(String date) {
		try {
			LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE);
			return true;
		} catch (DateTimeParseException e) {
			return false;
		}
	}

	private static boolean isInteger(String text) {
		return text.matches("[0-9]+");
	}

	private static String valueAt(List<String> values, int index) {
		if(index >= values.size() || values.get(index).isEmpty()) {
			return null;
		}
		return values.get(index);
	}

	private Citation parseCitation(IssueContext ctx, SetCommand command) {
		SourceLocation location = command.getLocation();
		List<String> values = command.getValues();
		if(!command.isList()) {
			ctx.report(new InvalidCitationIssue(location, "a citation must be a braced list of fields"));
			return null;
		}
		if(values.size() < 2) {
			ctx.report(new InvalidCitationIssue(location, "a citation needs at least a type and a reference"));
			return null;
		}
		if(values.size() > 6) {
			ctx.report(new InvalidCitationIssue(location, "a citation has at most 6 fields, found " + values.size()));
			return null;
		}
		String type = values.get(0);
		if(!CITATION_TYPES.contains(type)) {
			ctx.report(new InvalidCitationIssue(location, "unknown citation type " + type));
			return null;
		}
		if(values.size() == 2) {
			if(CITATION_TYPE_PUBMED.equals(type) && !isInteger(values.get(1))) {
				ctx.report(new InvalidCitationIssue(location, "PubMed identifier is not a number: " + values.get(1)));
				return null;
			}
			return new Citation(type, values.get(1));
		}
		String reference = values.get(2);
		if(CITATION_TYPE_PUBMED.equals(type) && !isInteger(reference)) {
			ctx.report(new InvalidCitationIssue(location, "PubMed identifier is not a number: " + reference));
			return null;
		}
		String date = valueAt(values, 3);
		if(date != null && !isValidDate(date)) {
			logger.fine("invalid citation date " + date + ", keeping only type, name and reference");
			return new Citation(type, reference, valueAt(values, 1), null, null, null);
		}
		String authors = valueAt(values, 4);
		return new Citation(
				type, reference, valueAt(values, 1), date,
				authors == null ? null : Arrays.asList(authors.split("\\" + AUTHOR_SEPARATOR)),
				valueAt(values, 5));
	}

	private class CommandExecutor extends ControlCommandVisitor<Void, RuntimeException> {

		private final IssueContext ctx;

		CommandExecutor(IssueContext ctx) {
			this.ctx = ctx;
		}

		private void setAnnotation(SetCommand setCommand) {
			String key = setCommand.getKey();
			if(requireCitation && citation == null) {
				ctx.report(new MissingCitationIssue(setCommand.getLocation()));
				return;
			}
			Set<String> values = new LinkedHashSet<>();
			try {
				if(!oracle.isAnnotationDefined(key)) {
					ctx.report(new UndefinedAnnotationIssue(setCommand.getLocation(), key));
					return;
				}
				for(String value : setCommand.getValues()) {
					if(!oracle.isAnnotationValue(key, value)) {
						ctx.report(new IllegalAnnotationValueIssue(setCommand.getLocation(), key, value));
						return;
					}
					values.add(value);
				}
			} catch (OracleException e) {
				ctx.report(new OracleFailureIssue(setCommand.getLocation(), e));
				return;
			}
			annotations.put(key, values);
		}

		/**
		 * Reports a list given for a key that holds a single value.
		 */
		private boolean rejectList(SetCommand setCommand) {
			if(!setCommand.isList()) {
				return false;
			}
			ctx.report(new IllegalAnnotationValueIssue(setCommand.getLocation(), setCommand.getKey(),
					String.join(", ", setCommand.getValues())));
			return true;
		}

		@Override
		public Void visit(SetCommand setCommand) {
			switch (setCommand.getKey()) {
				case CITATION:
					clearCitation();
					citation = parseCitation(ctx, setCommand);
					break;
				case EVIDENCE:
				case SUPPORTING_TEXT:
					if(rejectList(setCommand)) {
						break;
					}
					evidence = setCommand.getValues().get(0);
					break;
				case STATEMENT_GROUP:
					if(rejectList(setCommand)) {
						break;
					}
					statementGroup = setCommand.getValues().get(0);
					break;
				default:
					setAnnotation(setCommand);
			}
			return null;
		}

		private void unset(SourceLocation location, String key) {
			switch (key) {
				case CITATION:
					if(citation == null) {
						ctx.report(new MissingAnnotationKeyIssue(location, key));
					}
					clearCitation();
					break;
				case EVIDENCE:
				case SUPPORTING_TEXT:
					if(evidence == null) {
						ctx.report(new MissingAnnotationKeyIssue(location, key));
					}
					evidence = null;
					break;
				case STATEMENT_GROUP:
					if(statementGroup == null) {
						ctx.report(new MissingAnnotationKeyIssue(location, key));
					}
					statementGroup = null;
					break;
				default:
					if(annotations.remove(key) == null) {
						ctx.report(new MissingAnnotationKeyIssue(location, key));
					}
			}
		}

		@Override
		public Void visit(UnsetCommand unsetCommand) {
			if(unsetCommand.isUnsetAll()) {
				clear();
				return null;
			}
			for(String key : unsetCommand.getKeys()) {
				unset(unsetCommand.getLocation(), key);
			}
			return null;
		}
	}
}
