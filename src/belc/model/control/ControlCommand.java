package belc.model.control;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * A parsed {@code SET} or {@code UNSET} line of the statements section.
 */
public abstract class ControlCommand extends SourceLocatable {

	private final SourceLocation location;

	protected ControlCommand(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(ControlCommandVisitor<T, E> v) throws E;
}
