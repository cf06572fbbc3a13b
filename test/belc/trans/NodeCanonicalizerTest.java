package belc.trans;

import belc.VocabularyFixtures;
import belc.errors.TopLevelIssueContext;
import belc.formatters.BelEdgeFormatter;
import belc.parser.BelTermParser;
import belc.parser.LexicalContext;
import belc.parser.ParseFailureException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class NodeCanonicalizerTest {

	@Parameterized.Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"p(HGNC:AKT1)", "p(HGNC:AKT1)", "p(HGNC:AKT1)"},
				{"proteinAbundance(HGNC:AKT1, location(GO:nucleus))",
						"p(HGNC:AKT1)", "p(HGNC:AKT1, loc(GO:nucleus))"},
				{"p(HGNC:AKT1, var(\"p.Ala1Thr\"), pmod(Ph, Ser, 473))",
						"p(HGNC:AKT1, pmod(Ph, Ser, 473), var(\"p.Ala1Thr\"))",
						"p(HGNC:AKT1, pmod(Ph, Ser, 473), var(\"p.Ala1Thr\"))"},
				{"p(HGNC:AKT1, pmod(phosphorylation, S, 473))",
						"p(HGNC:AKT1, pmod(Ph, Ser, 473))", "p(HGNC:AKT1, pmod(Ph, Ser, 473))"},
				{"p(HGNC:AKT1, pmod(P, S, 473))",
						"p(HGNC:AKT1, pmod(Ph, Ser, 473))", "p(HGNC:AKT1, pmod(Ph, Ser, 473))"},
				{"p(HGNC:TP53, sub(R, 175, H))",
						"p(HGNC:TP53, var(\"p.Arg175His\"))", "p(HGNC:TP53, var(\"p.Arg175His\"))"},
				{"g(HGNC:CAT, sub(G, 275341, C))",
						"g(HGNC:CAT, var(\"c.275341G>C\"))", "g(HGNC:CAT, var(\"c.275341G>C\"))"},
				{"p(HGNC:AKT1, trunc(40))", "p(HGNC:AKT1, var(\"p.40*\"))", "p(HGNC:AKT1, var(\"p.40*\"))"},
				{"g(HGNC:AKT1, gmod(methylation))", "g(HGNC:AKT1, gmod(Me))", "g(HGNC:AKT1, gmod(Me))"},
				{"p(HGNC:AKT1, frag(5_20, \"fifty kDa\"))",
						"p(HGNC:AKT1, frag(\"5_20\", \"fifty kDa\"))", "p(HGNC:AKT1, frag(\"5_20\", \"fifty kDa\"))"},
				{"p(HGNC:BCR, fus(HGNC:JAK2, 1875, 2626))",
						"p(fus(HGNC:BCR, \"p.?_1875\", HGNC:JAK2, \"p.2626_?\"))",
						"p(fus(HGNC:BCR, \"p.?_1875\", HGNC:JAK2, \"p.2626_?\"))"},
				{"r(fus(HGNC:TMPRSS2, \"r.1_79\", HGNC:ERG, \"?\"))",
						"r(fus(HGNC:TMPRSS2, \"r.1_79\", HGNC:ERG, \"?\"))",
						"r(fus(HGNC:TMPRSS2, \"r.1_79\", HGNC:ERG, \"?\"))"},
				{"complex(p(HGNC:CD33), a(CHEBI:\"sialic acid\"))",
						"complex(a(CHEBI:\"sialic acid\"), p(HGNC:CD33))",
						"complex(a(CHEBI:\"sialic acid\"), p(HGNC:CD33))"},
				{"complexAbundance(SCOMP:\"AP-1 Complex\")",
						"complex(SCOMP:\"AP-1 Complex\")", "complex(SCOMP:\"AP-1 Complex\")"},
				{"rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:oxygen), a(CHEBI:\"hydrogen peroxide\")))",
						"rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:\"hydrogen peroxide\"), a(CHEBI:oxygen)))",
						"rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:\"hydrogen peroxide\"), a(CHEBI:oxygen)))"},
				{"kin(p(HGNC:AKT1))", "p(HGNC:AKT1)", "act(p(HGNC:AKT1), ma(kin))"},
				{"act(p(HGNC:AKT1))", "p(HGNC:AKT1)", "act(p(HGNC:AKT1))"},
				{"act(p(HGNC:AKT1, loc(GO:cytoplasm)), ma(kinaseActivity))",
						"p(HGNC:AKT1)", "act(p(HGNC:AKT1, loc(GO:cytoplasm)), ma(kin))"},
				{"deg(r(HGNC:AKT1))", "r(HGNC:AKT1)", "deg(r(HGNC:AKT1))"},
				{"tloc(p(HGNC:TP53), GO:cytoplasm, GO:nucleus)",
						"p(HGNC:TP53)", "tloc(p(HGNC:TP53), fromLoc(GO:cytoplasm), toLoc(GO:nucleus))"},
				{"sec(p(HGNC:TP53))", "p(HGNC:TP53)", "sec(p(HGNC:TP53))"},
				{"path(MESH:\"Alzheimer Disease\")", "path(MESH:\"Alzheimer Disease\")", "path(MESH:\"Alzheimer Disease\")"},
		});
	}

	private final String input;
	private final String expectedNode;
	private final String expectedEndpoint;

	public NodeCanonicalizerTest(String input, String expectedNode, String expectedEndpoint) {
		this.input = input;
		this.expectedNode = expectedNode;
		this.expectedEndpoint = expectedEndpoint;
	}

	@Test
	public void testCanonicalForm() throws ParseFailureException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		NodeCanonicalizer canonicalizer = new NodeCanonicalizer(ctx,
				new IdentifierResolver(VocabularyFixtures.permissive(), false));
		CanonicalTerm term = BelTermParser.readTerm(new LexicalContext(1, input)).accept(canonicalizer);
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(term.getNode().toBel(), is(expectedNode));
		assertThat(BelEdgeFormatter.formatEndpoint(term.getNode(), term.getContext()), is(expectedEndpoint));
	}

	@Test
	public void testCanonicalFormIsAFixedPoint() throws ParseFailureException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		NodeCanonicalizer canonicalizer = new NodeCanonicalizer(ctx,
				new IdentifierResolver(VocabularyFixtures.permissive(), false));
		CanonicalTerm term = BelTermParser.readTerm(new LexicalContext(1, expectedEndpoint)).accept(canonicalizer);
		assertThat(ctx.getIssues().size(), is(0));
		assertThat(BelEdgeFormatter.formatEndpoint(term.getNode(), term.getContext()), is(expectedEndpoint));
	}
}
