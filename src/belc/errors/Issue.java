package belc.errors;

import belc.BelException;
import belc.Unreachable;
import belc.formatters.IndentingWriter;
import belc.formatters.IssueFormattingVisitor;
import belc.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A diagnostic about one line of BEL. Issues are exceptions so that they can be thrown when compilation should
 * stop, but are normally reported into an {@link IssueContext} and compilation carries on.
 */
public abstract class Issue extends BelException {

	private static final String prefix = "BEL Issue";

	private final Severity severity;
	private final SourceLocation location;

	protected Issue(Severity severity, SourceLocation location) {
		super(prefix, "");
		this.severity = severity;
		this.location = location == null ? SourceLocation.unknown() : location;
	}

	public Severity getSeverity() {
		return severity;
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	/**
	 * @return where on the line the issue was found; unknown if the whole line is at fault
	 */
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
