package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code complex(member, ...)} or {@code composite(member, ...)}.
 */
public class ListAbundanceToken extends AbundanceToken {

	private final List<AbundanceToken> members;

	public ListAbundanceToken(SourceLocation location, BelFunction function, List<AbundanceToken> members,
	                          IdentifierToken cellularLocation) {
		super(location, function, cellularLocation);
		this.members = Collections.unmodifiableList(members);
	}

	public List<AbundanceToken> getMembers() {
		return members;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
