package belc.parser;

import belc.util.SourceLocatable;

/**
 * Wraps a grammar without changing what it accepts, only how many of its parses are explored or how often they are
 * computed.
 */
public abstract class RestrictedGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private final Grammar<Result> inner;

	private RestrictedGrammar(Grammar<Result> inner) {
		this.inner = inner;
	}

	public Grammar<Result> getInner() { return inner; }

	/**
	 * Keeps only the first parse of the inner grammar.
	 */
	public static final class Cut<Result extends SourceLocatable> extends RestrictedGrammar<Result> {
		Cut(Grammar<Result> inner) {
			super(inner);
		}

		@Override
		public String toString() {
			return "CUT " + getInner();
		}

		@Override
		public <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except {
			return visitor.visit(this);
		}
	}

	/**
	 * Computes the parses of the inner grammar once per position of a line.
	 */
	public static final class Memoize<Result extends SourceLocatable> extends RestrictedGrammar<Result> {
		Memoize(Grammar<Result> inner) {
			super(inner);
		}

		@Override
		public String toString() {
			return "MEMO " + getInner();
		}

		@Override
		public <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except {
			return visitor.visit(this);
		}
	}
}
