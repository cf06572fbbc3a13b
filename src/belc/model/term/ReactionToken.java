package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class ReactionToken extends AbundanceToken {

	private final List<AbundanceToken> reactants;
	private final List<AbundanceToken> products;

	public ReactionToken(SourceLocation location, List<AbundanceToken> reactants, List<AbundanceToken> products) {
		super(location, BelFunction.REACTION, null);
		this.reactants = Collections.unmodifiableList(reactants);
		this.products = Collections.unmodifiableList(products);
	}

	public List<AbundanceToken> getReactants() {
		return reactants;
	}

	public List<AbundanceToken> getProducts() {
		return products;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
