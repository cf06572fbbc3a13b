package belc.util;

/**
 * A common base for anything produced by the parser that should be traceable back to the span of BEL text it was
 * read from.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
