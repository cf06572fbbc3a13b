package belc.model.control;

import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code SET key = "value"} or {@code SET key = {"v1", "v2"}}.
 */
public class SetCommand extends ControlCommand {

	private final String key;
	private final List<String> values;
	private final boolean list;

	public SetCommand(SourceLocation location, String key, List<String> values, boolean list) {
		super(location);
		this.key = key;
		this.values = Collections.unmodifiableList(values);
		this.list = list;
	}

	public String getKey() {
		return key;
	}

	public List<String> getValues() {
		return values;
	}

	/**
	 * @return whether the values were written as a braced list, even a list of one
	 */
	public boolean isList() {
		return list;
	}

	@Override
	public <T, E extends Throwable> T accept(ControlCommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
