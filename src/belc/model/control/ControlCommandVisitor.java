package belc.model.control;

public abstract class ControlCommandVisitor<T, E extends Throwable> {
	public abstract T visit(SetCommand setCommand) throws E;
	public abstract T visit(UnsetCommand unsetCommand) throws E;
}
