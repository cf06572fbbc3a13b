package belc.model.graph;

public abstract class VariantVisitor<T, E extends Throwable> {
	public abstract T visit(HgvsVariant hgvsVariant) throws E;
	public abstract T visit(ProteinModification proteinModification) throws E;
	public abstract T visit(GeneModification geneModification) throws E;
	public abstract T visit(Fragment fragment) throws E;
}
