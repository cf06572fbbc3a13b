package belc.model.control;

import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code UNSET key}, {@code UNSET {k1, k2}} or {@code UNSET ALL}.
 */
public class UnsetCommand extends ControlCommand {

	public static final String ALL = "ALL";

	private final List<String> keys;

	public UnsetCommand(SourceLocation location, List<String> keys) {
		super(location);
		this.keys = Collections.unmodifiableList(keys);
	}

	public List<String> getKeys() {
		return keys;
	}

	public boolean isUnsetAll() {
		return keys.size() == 1 && ALL.equals(keys.get(0));
	}

	@Override
	public <T, E extends Throwable> T accept(ControlCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
