package belc.trans;

import belc.errors.IssueContext;
import belc.model.graph.Concept;
import belc.model.term.IdentifierToken;
import belc.oracle.NamespaceOracle;
import belc.oracle.OracleException;

/**
 * Turns identifier tokens into concepts, checking them against a {@link NamespaceOracle}.
 *
 * A concept is always returned so that canonicalization can carry on and report every problem on a line; whether
 * the concept may be used is decided by the issues reported alongside it.
 */
public class IdentifierResolver {

	/**
	 * The namespace given to bare names when they are allowed.
	 */
	public static final String NAKED_NAMESPACE = "dirty";

	private final NamespaceOracle oracle;
	private final boolean allowNakedNames;

	public IdentifierResolver(NamespaceOracle oracle, boolean allowNakedNames) {
		this.oracle = oracle;
		this.allowNakedNames = allowNakedNames;
	}

	public boolean allowsNakedNames() {
		return allowNakedNames;
	}

	public Concept resolve(IssueContext ctx, IdentifierToken identifier) {
		if(identifier.isBuiltin()) {
			return new Concept(IdentifierToken.BEL_NAMESPACE, identifier.getName());
		}
		if(!identifier.isQualified()) {
			if(!allowNakedNames) {
				ctx.report(new NakedNameIssue(identifier));
			}
			return new Concept(NAKED_NAMESPACE, identifier.getName());
		}
		Concept concept = new Concept(identifier.getNamespace(), identifier.getName());
		if(allowNakedNames && NAKED_NAMESPACE.equals(identifier.getNamespace())) {
			return concept;
		}
		try {
			if(!oracle.isNamespaceDefined(identifier.getNamespace())) {
				ctx.report(new UndefinedNamespaceIssue(identifier));
			} else if(!oracle.isMember(identifier.getNamespace(), identifier.getName())) {
				ctx.report(new MissingNamespaceNameIssue(identifier));
			}
		} catch (OracleException e) {
			ctx.report(new OracleFailureIssue(identifier.getLocation(), e));
		}
		return concept;
	}
}
