package belc.model.term;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * A {@code namespace:name} reference as written in the source. The namespace is null for a bare name.
 */
public class IdentifierToken extends SourceLocatable {

	/**
	 * The namespace of the vocabularies built into BEL itself (default pmod, gmod and activity names). Names in it
	 * are never checked against the namespace oracle.
	 */
	public static final String BEL_NAMESPACE = "bel";

	private final SourceLocation location;
	private final String namespace;
	private final String name;

	public IdentifierToken(SourceLocation location, String namespace, String name) {
		this.location = location;
		this.namespace = namespace;
		this.name = name;
	}

	public static IdentifierToken builtin(SourceLocation location, String name) {
		return new IdentifierToken(location, BEL_NAMESPACE, name);
	}

	public String getNamespace() {
		return namespace;
	}

	public String getName() {
		return name;
	}

	public boolean isQualified() {
		return namespace != null;
	}

	public boolean isBuiltin() {
		return BEL_NAMESPACE.equals(namespace);
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return namespace == null ? name : namespace + ":" + name;
	}
}
