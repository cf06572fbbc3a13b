package belc.model.term;

public abstract class VariantTokenVisitor<T, E extends Throwable> {
	public abstract T visit(HgvsToken hgvsToken) throws E;
	public abstract T visit(ProteinModificationToken proteinModificationToken) throws E;
	public abstract T visit(GeneModificationToken geneModificationToken) throws E;
	public abstract T visit(FragmentToken fragmentToken) throws E;
}
