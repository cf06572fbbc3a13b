package belc.model.metadata;

import belc.util.SourceLocation;

/**
 * {@code DEFINE NAMESPACE ...} or {@code DEFINE ANNOTATION ...}.
 */
public class DefinitionToken extends MetadataToken {

	public enum Target {
		NAMESPACE,
		ANNOTATION
	}

	private final Target target;
	private final Definition definition;

	public DefinitionToken(SourceLocation location, Target target, Definition definition) {
		super(location);
		this.target = target;
		this.definition = definition;
	}

	public Target getTarget() {
		return target;
	}

	public Definition getDefinition() {
		return definition;
	}

	@Override
	public <T, E extends Throwable> T accept(MetadataTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
