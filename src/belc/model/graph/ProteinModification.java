package belc.model.graph;

public final class ProteinModification extends Variant {

	private final Concept modification;
	private final String code;
	private final Integer position;

	/**
	 * @param code     three-letter amino acid code, or null
	 * @param position residue position, or null; only meaningful with a code
	 */
	public ProteinModification(Concept modification, String code, Integer position) {
		this.modification = modification;
		this.code = code;
		this.position = position;
	}

	public Concept getModification() {
		return modification;
	}

	public String getCode() {
		return code;
	}

	public Integer getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
