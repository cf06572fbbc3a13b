package belc.parser;

import belc.util.EmptyHeterogenousList;
import belc.util.HeterogenousList;
import belc.util.SourceLocatable;

public class PartSequenceGrammar<Part extends SourceLocatable, PrevResult extends EmptyHeterogenousList>
		extends AbstractSequenceGrammar<HeterogenousList<Part, PrevResult>> {

	private final Grammar<Located<PrevResult>> previous;
	private final Grammar<Part> current;

	public PartSequenceGrammar(Grammar<Located<PrevResult>> previous, Grammar<Part> current) {
		this.previous = previous;
		this.current = current;
	}

	public Grammar<Located<PrevResult>> getPrevious() { return previous; }
	public Grammar<Part> getCurrent() { return current; }

	@Override
	public String toString() {
		return previous + " PART " + current;
	}

	@Override
	public <Result, Except extends Throwable> Result accept(GrammarVisitor<Result, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
