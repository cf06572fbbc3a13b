package belc.model.metadata;

import belc.util.SourceLocation;

/**
 * {@code SET DOCUMENT key = "value"}. The key is not checked by the grammar.
 */
public class DocumentPropertyToken extends MetadataToken {

	private final String key;
	private final String value;

	public DocumentPropertyToken(SourceLocation location, String key, String value) {
		super(location);
		this.key = key;
		this.value = value;
	}

	public String getKey() {
		return key;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(MetadataTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
