package belc.parser;

import belc.util.SourceLocatable;

import java.util.Objects;

/**
 * A forward reference to a grammar that is filled in later, used to build the recursive parts of the BEL grammar
 * (terms nested inside complexes, reactions and modifier functions).
 */
public class ReferenceGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private Grammar<Result> referencedGrammar;

	public ReferenceGrammar() {
		this.referencedGrammar = null;
	}

	public void setReferencedGrammar(Grammar<Result> referencedGrammar) {
		Objects.requireNonNull(referencedGrammar);
		if(this.referencedGrammar != null) {
			throw new IllegalStateException("grammar reference already set");
		}
		this.referencedGrammar = referencedGrammar;
	}

	public Grammar<Result> getReferencedGrammar() {
		if(referencedGrammar == null) {
			throw new IllegalStateException("grammar reference used before being set");
		}
		return referencedGrammar;
	}

	@Override
	public String toString() {
		return "REF";
	}

	@Override
	public <Result1, Except extends Throwable> Result1 accept(GrammarVisitor<Result1, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
