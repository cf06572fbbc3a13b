package belc.model.graph;

/**
 * {@code var("...")}. The HGVS expression is kept verbatim.
 */
public final class HgvsVariant extends Variant {

	private final String expression;

	public HgvsVariant(String expression) {
		this.expression = expression;
	}

	public String getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
