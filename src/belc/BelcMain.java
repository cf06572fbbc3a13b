package belc;

import belc.formatters.BelDocumentWriter;
import belc.model.graph.BelGraph;
import belc.model.graph.BelWarning;
import belc.trans.StatementParseException;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Compiles one BEL document and prints it back in canonical form: {@code belc document.bel [config.json]}.
 */
public class BelcMain {
	private final String[] cmdArgs;
	private final Writer output;
	private static final Logger logger = Logger.getLogger("BelcMain");

	public BelcMain(String[] args, Writer output) {
		this.cmdArgs = args;
		this.output = output;
	}

	public static void main(String[] args) {
		Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
		if (new BelcMain(args, out).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * @return whether the document compiled without errors
	 */
	public boolean run() {
		if (cmdArgs.length < 1 || cmdArgs.length > 2) {
			logger.severe("usage: belc document.bel [config.json]");
			return false;
		}
		try {
			BelcOptions options = cmdArgs.length == 2 ? BelcOptions.read(new File(cmdArgs[1])) : new BelcOptions();
			BelCompiler compiler = BelCompiler.fromOptions(options);
			BelGraph graph = compiler.compileFile(new File(cmdArgs[0]));
			boolean errors = false;
			for (BelWarning warning : graph.getWarnings()) {
				logger.warning(warning.toString());
				errors |= warning.getIssue().isError();
			}
			BelDocumentWriter.write(graph, output);
			output.flush();
			return !errors;
		} catch (BelcOptionException e) {
			logger.severe(e.getMessage());
		} catch (StatementParseException e) {
			logger.severe(e.getMessage());
		} catch (IOException e) {
			logger.severe("I/O error: " + e.getMessage());
		}
		return false;
	}
}
