package belc.formatters;

import belc.errors.IssueVisitor;
import belc.trans.*;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GrammarIssue grammarIssue) throws IOException {
		out.write("error parsing " + grammarIssue.getLanguage() + ": ");
		out.write(grammarIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(UndefinedNamespaceIssue undefinedNamespaceIssue) throws IOException {
		out.write("undefined namespace \"");
		out.write(undefinedNamespaceIssue.getIdentifier().getNamespace());
		out.write("\" in ");
		out.write(undefinedNamespaceIssue.getIdentifier().toString());
		return null;
	}

	@Override
	public Void visit(MissingNamespaceNameIssue missingNamespaceNameIssue) throws IOException {
		out.write("\"");
		out.write(missingNamespaceNameIssue.getIdentifier().getName());
		out.write("\" is not a name in namespace ");
		out.write(missingNamespaceNameIssue.getIdentifier().getNamespace());
		return null;
	}

	@Override
	public Void visit(NakedNameIssue nakedNameIssue) throws IOException {
		out.write("name \"");
		out.write(nakedNameIssue.getIdentifier().getName());
		out.write("\" is missing a namespace");
		return null;
	}

	@Override
	public Void visit(OracleFailureIssue oracleFailureIssue) throws IOException {
		out.write("namespace lookup failed: ");
		out.write(oracleFailureIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(UndefinedAnnotationIssue undefinedAnnotationIssue) throws IOException {
		out.write("undefined annotation \"");
		out.write(undefinedAnnotationIssue.getKey());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(IllegalAnnotationValueIssue illegalAnnotationValueIssue) throws IOException {
		out.write("\"");
		out.write(illegalAnnotationValueIssue.getValue());
		out.write("\" is not a value of annotation ");
		out.write(illegalAnnotationValueIssue.getKey());
		return null;
	}

	@Override
	public Void visit(MissingAnnotationKeyIssue missingAnnotationKeyIssue) throws IOException {
		out.write("cannot unset \"");
		out.write(missingAnnotationKeyIssue.getKey());
		out.write("\": it is not set");
		return null;
	}

	@Override
	public Void visit(NestedRelationNotSupportedIssue nestedRelationNotSupportedIssue) throws IOException {
		out.write("nested statements are not supported; write each relation on its own line");
		return null;
	}

	@Override
	public Void visit(IllegalTranslocationIssue illegalTranslocationIssue) throws IOException {
		out.write("tloc needs fromLoc and toLoc arguments");
		return null;
	}

	@Override
	public Void visit(ModifiedListSubjectIssue modifiedListSubjectIssue) throws IOException {
		out.write("the subject of " + modifiedListSubjectIssue.getRelation().getCanonicalName() +
				" cannot carry an activity, degradation, translocation or location");
		return null;
	}

	@Override
	public Void visit(PlaceholderAminoAcidIssue placeholderAminoAcidIssue) throws IOException {
		out.write("placeholder amino acid X is not allowed in pmod");
		return null;
	}

	@Override
	public Void visit(InvalidCitationIssue invalidCitationIssue) throws IOException {
		out.write("invalid citation: ");
		out.write(invalidCitationIssue.getReason());
		return null;
	}

	@Override
	public Void visit(MissingCitationIssue missingCitationIssue) throws IOException {
		out.write("no citation is set");
		return null;
	}

	@Override
	public Void visit(MissingSupportIssue missingSupportIssue) throws IOException {
		out.write("no evidence (SupportingText) is set");
		return null;
	}

	@Override
	public Void visit(MalformedMetadataIssue malformedMetadataIssue) throws IOException {
		out.write("malformed document metadata: ");
		out.write(malformedMetadataIssue.getReason());
		return null;
	}

	@Override
	public Void visit(RedefinedKeywordIssue redefinedKeywordIssue) throws IOException {
		out.write(redefinedKeywordIssue.getKind());
		out.write(" ");
		out.write(redefinedKeywordIssue.getKeyword());
		out.write(" is redefined; the newer definition is used");
		return null;
	}

	@Override
	public Void visit(DeprecatedSyntaxIssue deprecatedSyntaxIssue) throws IOException {
		out.write("deprecated syntax ");
		out.write(deprecatedSyntaxIssue.getLegacySyntax());
		out.write(", use ");
		out.write(deprecatedSyntaxIssue.getReplacement());
		return null;
	}
}
