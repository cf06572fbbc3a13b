package belc.model.metadata;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * A parsed line of the definitions section of a BEL document.
 */
public abstract class MetadataToken extends SourceLocatable {

	private final SourceLocation location;

	protected MetadataToken(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(MetadataTokenVisitor<T, E> v) throws E;
}
