package belc.formatters;

import belc.model.graph.*;

import java.io.IOException;

public class VariantFormattingVisitor extends VariantVisitor<Void, IOException> {

	private final IndentingWriter out;

	public VariantFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(HgvsVariant hgvsVariant) throws IOException {
		out.write("var(");
		out.write(FormattingTools.quote(hgvsVariant.getExpression()));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ProteinModification proteinModification) throws IOException {
		out.write("pmod(");
		FormattingTools.writeConcept(out, proteinModification.getModification());
		if(proteinModification.getCode() != null) {
			out.write(", ");
			out.write(proteinModification.getCode());
			if(proteinModification.getPosition() != null) {
				out.write(", ");
				out.write(proteinModification.getPosition().toString());
			}
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GeneModification geneModification) throws IOException {
		out.write("gmod(");
		FormattingTools.writeConcept(out, geneModification.getModification());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Fragment fragment) throws IOException {
		out.write("frag(");
		if(fragment.isMissing()) {
			out.write("\"?\"");
		} else {
			out.write(FormattingTools.quote(fragment.getStart() + "_" + fragment.getStop()));
		}
		if(fragment.getDescription() != null) {
			out.write(", ");
			out.write(FormattingTools.quote(fragment.getDescription()));
		}
		out.write(")");
		return null;
	}
}
