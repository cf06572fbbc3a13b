package belc;

import belc.errors.Issue;
import belc.errors.TopLevelIssueContext;
import belc.lexer.DocumentSplitter;
import belc.lexer.LineSanitizer;
import belc.lexer.LogicalLine;
import belc.model.graph.BelGraph;
import belc.oracle.DefinedVocabulary;
import belc.oracle.JsonVocabulary;
import belc.oracle.NamespaceOracle;
import belc.parser.BelControlParser;
import belc.trans.ControlParser;
import belc.trans.GraphBuilder;
import belc.trans.IdentifierResolver;
import belc.trans.MetadataParser;
import belc.trans.StatementCompiler;
import belc.trans.StatementParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Compiles BEL documents into {@link BelGraph}s.
 *
 * A compiler holds no per-document state and may be shared; every call to {@code compile} uses its own control
 * parser and graph. Issues found on a line are recorded as warnings of the graph and compilation carries on with the
 * next line, unless the options ask to stop on the first error.
 */
public class BelCompiler {

	private static final Logger logger = Logger.getLogger("BelCompiler");

	private final BelcOptions options;
	private final NamespaceOracle vocabulary;

	/**
	 * @param vocabulary the oracle for namespaces and annotations the documents do not define themselves; may be
	 *                   null
	 */
	public BelCompiler(BelcOptions options, NamespaceOracle vocabulary) {
		this.options = options;
		this.vocabulary = vocabulary;
	}

	/**
	 * Builds a compiler, loading the vocabulary the options name, if any.
	 */
	public static BelCompiler fromOptions(BelcOptions options) throws BelcOptionException {
		NamespaceOracle vocabulary = null;
		if (options.vocabularyPath != null) {
			logger.info("Loading vocabulary " + options.vocabularyPath);
			try {
				vocabulary = JsonVocabulary.fromFile(Paths.get(options.vocabularyPath));
			} catch (IOException e) {
				throw new BelcOptionException("Error reading vocabulary: " + e.getMessage(), e);
			}
		}
		return new BelCompiler(options, vocabulary);
	}

	public BelcOptions getOptions() {
		return options;
	}

	public BelGraph compileFile(File file) throws IOException {
		logger.info("Reading " + file);
		return compile(FileUtils.readLines(file, StandardCharsets.UTF_8));
	}

	public BelGraph compile(InputStream in) throws IOException {
		return compile(IOUtils.readLines(in, StandardCharsets.UTF_8));
	}

	public BelGraph compile(String document) {
		return compile(Arrays.asList(document.split("\r?\n", -1)));
	}

	/**
	 * @throws StatementParseException on the first error, if the options ask to stop on errors
	 */
	public BelGraph compile(List<String> physicalLines) {
		BelGraph graph = new BelGraph();

		logger.info("Sanitizing lines");
		List<LogicalLine> lines = new LineSanitizer(physicalLines).readLines();
		DocumentSplitter document = DocumentSplitter.split(lines);

		logger.info("Parsing definitions");
		MetadataParser metadataParser = new MetadataParser(graph.getMetadata());
		for (LogicalLine line : document.getDefinitions()) {
			processLine(graph, line, Collections::emptyMap, ctx -> metadataParser.processLine(
					ctx, line.getLineNumber(), line.getText()));
		}

		NamespaceOracle oracle = new DefinedVocabulary(graph.getMetadata(), vocabulary);
		IdentifierResolver resolver = new IdentifierResolver(oracle, options.allowNakedNames);
		ControlParser control = new ControlParser(oracle, options.requireCitation);
		StatementCompiler statementCompiler = new StatementCompiler(
				new GraphBuilder(graph, options.completeOrigin), resolver, control,
				options.requireCitation, options.requireEvidence);

		logger.info("Compiling statements");
		for (LogicalLine line : document.getStatements()) {
			if (control.isAccumulating() || BelControlParser.isControlLine(line.getText())) {
				processLine(graph, line, control::currentAnnotations, ctx -> control.processLine(ctx, line.getLineNumber(), line.getText()));
			} else {
				processLine(graph, line, control::currentAnnotations, ctx -> statementCompiler.processLine(
						ctx, line.getLineNumber(), line.getText()));
			}
		}
		if (control.isAccumulating()) {
			logger.warning("Document ends inside an unterminated evidence");
		}

		logger.info("Compiled " + graph.numberOfNodes() + " node(s), " + graph.numberOfEdges() + " edge(s) and " +
				graph.getWarnings().size() + " warning(s)");
		return graph;
	}

	/**
	 * Runs one line and records its issues together with the context in effect once the line has run.
	 */
	private void processLine(BelGraph graph, LogicalLine line, Supplier<Map<String, Set<String>>> annotations,
	                         Consumer<TopLevelIssueContext> action) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		action.accept(ctx);
		if (ctx.getIssues().isEmpty()) {
			return;
		}
		logger.fine("line " + line.getLineNumber() + ": " + ctx.format());
		Map<String, Set<String>> snapshot = annotations.get();
		for (Issue issue : ctx.getIssues()) {
			if (options.stopOnError && issue.isError()) {
				throw new StatementParseException(line.getLineNumber(), line.getText(), issue);
			}
			graph.addWarning(line.getLineNumber(), line.getText(), issue, snapshot);
		}
	}
}
