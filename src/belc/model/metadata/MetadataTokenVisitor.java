package belc.model.metadata;

public abstract class MetadataTokenVisitor<T, E extends Throwable> {
	public abstract T visit(DocumentPropertyToken documentPropertyToken) throws E;
	public abstract T visit(DefinitionToken definitionToken) throws E;
}
