package belc.model.statement;

public abstract class StatementTokenVisitor<T, E extends Throwable> {
	public abstract T visit(TermStatementToken termStatementToken) throws E;
	public abstract T visit(RelationStatementToken relationStatementToken) throws E;
	public abstract T visit(NestedStatementToken nestedStatementToken) throws E;
	public abstract T visit(ListStatementToken listStatementToken) throws E;
}
