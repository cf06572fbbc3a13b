package belc.parser;

import belc.util.SourceLocatable;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * The grammars that consume text of a line directly. Everything else is built from these.
 */
public abstract class TerminalGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private TerminalGrammar() {}

	/**
	 * Matches one exact piece of text, such as a function keyword or a relation symbol.
	 */
	public static final class Literal extends TerminalGrammar<Located<Void>> {
		private final String text;

		Literal(String text) {
			this.text = text;
		}

		public String getText() { return text; }

		@Override
		public String toString() {
			return "\"" + text + "\"";
		}

		@Override
		public <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except {
			return visitor.visit(this);
		}
	}

	/**
	 * Matches a regular expression anchored at the current position.
	 */
	public static final class Regex extends TerminalGrammar<Located<MatchResult>> {
		private final Pattern pattern;

		Regex(Pattern pattern) {
			this.pattern = pattern;
		}

		public Pattern getPattern() { return pattern; }

		@Override
		public String toString() {
			return "/" + pattern + "/";
		}

		@Override
		public <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except {
			return visitor.visit(this);
		}
	}

	/**
	 * Matches only once the whole logical line has been consumed.
	 */
	public static final class EndOfLine extends TerminalGrammar<Located<Void>> {
		EndOfLine() {}

		@Override
		public String toString() {
			return "EOL";
		}

		@Override
		public <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except {
			return visitor.visit(this);
		}
	}
}
