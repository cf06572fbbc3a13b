package belc.formatters;

import belc.Unreachable;
import belc.model.graph.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes nodes as canonical BEL. The output of this visitor defines node identity, so it must depend on nothing
 * but node content.
 */
public class BelNodeFormattingVisitor extends BelNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public BelNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	public static String format(BelNode node) {
		StringWriter w = new StringWriter();
		try {
			node.accept(new BelNodeFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public static String formatVariant(Variant variant) {
		StringWriter w = new StringWriter();
		try {
			variant.accept(new VariantFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private void writeMembers(List<BelNode> members) throws IOException {
		FormattingTools.writeCommaSeparated(out, members, member -> member.accept(this));
	}

	private void writeFusionRange(FusionRange range) throws IOException {
		out.write(FormattingTools.quote(range.toString()));
	}

	@Override
	public Void visit(SimpleNode simpleNode) throws IOException {
		out.write(simpleNode.getFunction().getShortName());
		out.write("(");
		FormattingTools.writeConcept(out, simpleNode.getConcept());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(VariantNode variantNode) throws IOException {
		out.write(variantNode.getFunction().getShortName());
		out.write("(");
		FormattingTools.writeConcept(out, variantNode.getConcept());
		VariantFormattingVisitor variantFormatter = new VariantFormattingVisitor(out);
		for(Variant variant : variantNode.getVariants()) {
			out.write(", ");
			variant.accept(variantFormatter);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(FusionNode fusionNode) throws IOException {
		out.write(fusionNode.getFunction().getShortName());
		out.write("(fus(");
		FormattingTools.writeConcept(out, fusionNode.getPartner5p());
		out.write(", ");
		writeFusionRange(fusionNode.getRange5p());
		out.write(", ");
		FormattingTools.writeConcept(out, fusionNode.getPartner3p());
		out.write(", ");
		writeFusionRange(fusionNode.getRange3p());
		out.write("))");
		return null;
	}

	@Override
	public Void visit(ListNode listNode) throws IOException {
		out.write(listNode.getFunction().getShortName());
		out.write("(");
		writeMembers(listNode.getMembers());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ReactionNode reactionNode) throws IOException {
		out.write("rxn(reactants(");
		writeMembers(reactionNode.getReactants());
		out.write("), products(");
		writeMembers(reactionNode.getProducts());
		out.write("))");
		return null;
	}
}
