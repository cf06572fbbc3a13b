package belc.errors;

import belc.trans.*;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(GrammarIssue grammarIssue) throws E;
	public abstract T visit(UndefinedNamespaceIssue undefinedNamespaceIssue) throws E;
	public abstract T visit(MissingNamespaceNameIssue missingNamespaceNameIssue) throws E;
	public abstract T visit(NakedNameIssue nakedNameIssue) throws E;
	public abstract T visit(OracleFailureIssue oracleFailureIssue) throws E;
	public abstract T visit(UndefinedAnnotationIssue undefinedAnnotationIssue) throws E;
	public abstract T visit(IllegalAnnotationValueIssue illegalAnnotationValueIssue) throws E;
	public abstract T visit(MissingAnnotationKeyIssue missingAnnotationKeyIssue) throws E;
	public abstract T visit(NestedRelationNotSupportedIssue nestedRelationNotSupportedIssue) throws E;
	public abstract T visit(IllegalTranslocationIssue illegalTranslocationIssue) throws E;
	public abstract T visit(ModifiedListSubjectIssue modifiedListSubjectIssue) throws E;
	public abstract T visit(PlaceholderAminoAcidIssue placeholderAminoAcidIssue) throws E;
	public abstract T visit(InvalidCitationIssue invalidCitationIssue) throws E;
	public abstract T visit(MissingCitationIssue missingCitationIssue) throws E;
	public abstract T visit(MissingSupportIssue missingSupportIssue) throws E;
	public abstract T visit(MalformedMetadataIssue malformedMetadataIssue) throws E;
	public abstract T visit(RedefinedKeywordIssue redefinedKeywordIssue) throws E;
	public abstract T visit(DeprecatedSyntaxIssue deprecatedSyntaxIssue) throws E;
}
