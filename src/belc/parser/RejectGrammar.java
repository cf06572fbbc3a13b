package belc.parser;

import belc.util.SourceLocatable;

public class RejectGrammar<Rejected extends SourceLocatable> extends Grammar<Located<Void>> {

	private final Grammar<Rejected> toReject;

	public RejectGrammar(Grammar<Rejected> toReject) {
		this.toReject = toReject;
	}

	public Grammar<Rejected> getToReject() { return toReject; }

	@Override
	public String toString() {
		return "REJECT [" + toReject + "]";
	}

	@Override
	public <Result, Except extends Throwable> Result accept(GrammarVisitor<Result, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
