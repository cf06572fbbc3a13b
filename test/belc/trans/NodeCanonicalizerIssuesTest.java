package belc.trans;

import belc.VocabularyFixtures;
import belc.errors.Issue;
import belc.errors.TopLevelIssueContext;
import belc.model.graph.BelNode;
import belc.oracle.NamespaceOracle;
import belc.parser.BelTermParser;
import belc.parser.LexicalContext;
import belc.parser.ParseFailureException;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class NodeCanonicalizerIssuesTest {

	private static List<Issue> issues(NamespaceOracle oracle, boolean allowNakedNames, String text)
			throws ParseFailureException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		BelTermParser.readTerm(new LexicalContext(1, text))
				.accept(new NodeCanonicalizer(ctx, new IdentifierResolver(oracle, allowNakedNames)));
		return ctx.getIssues();
	}

	private static List<Issue> issues(String text) throws ParseFailureException, IOException {
		return issues(VocabularyFixtures.fromResource(), false, text);
	}

	@Test
	public void testLegacySyntaxIsReported() throws Exception {
		List<Issue> found = issues("p(HGNC:TP53, sub(R, 175, H))");
		assertThat(found.size(), is(1));
		DeprecatedSyntaxIssue issue = (DeprecatedSyntaxIssue) found.get(0);
		assertFalse(issue.isError());
		assertThat(issue.getLegacySyntax(), is("sub(Arg, 175, His)"));
		assertThat(issue.getReplacement(), is("var(\"p.Arg175His\")"));

		DeprecatedSyntaxIssue activity = (DeprecatedSyntaxIssue) issues("kin(p(HGNC:AKT1))").get(0);
		assertThat(activity.getReplacement(), is("act(p(HGNC:AKT1), ma(kin))"));

		DeprecatedSyntaxIssue fusion = (DeprecatedSyntaxIssue) issues("p(HGNC:BCR, fus(HGNC:JAK2))").get(0);
		assertThat(fusion.getReplacement(), is("p(fus(HGNC:BCR, \"?\", HGNC:JAK2, \"?\"))"));
	}

	@Test
	public void testPlaceholderAminoAcid() throws Exception {
		List<Issue> found = issues("p(HGNC:AKT1, pmod(Ph, X, 10))");
		assertThat(found.size(), is(1));
		assertThat(found.get(0), instanceOf(PlaceholderAminoAcidIssue.class));
		assertTrue(found.get(0).isError());
	}

	@Test
	public void testUnqualifiedTranslocation() throws Exception {
		List<Issue> found = issues("tloc(p(HGNC:TP53))");
		assertThat(found.size(), is(1));
		assertThat(found.get(0), instanceOf(IllegalTranslocationIssue.class));
	}

	@Test
	public void testUnknownNames() throws Exception {
		assertThat(issues("p(UNIPROT:P31749)").get(0), instanceOf(UndefinedNamespaceIssue.class));
		assertThat(issues("p(HGNC:NOT_A_GENE)").get(0), instanceOf(MissingNamespaceNameIssue.class));
		assertThat(issues("tloc(p(HGNC:TP53), fromLoc(GO:cytoplasm), toLoc(GO:mitochondrion))").get(0),
				instanceOf(MissingNamespaceNameIssue.class));
	}

	@Test
	public void testEveryProblemOnALineIsReported() throws Exception {
		List<Issue> found = issues("complex(p(HGNC:NOT_A_GENE), p(UNIPROT:P31749), p(AKT1))");
		assertThat(found.size(), is(3));
		assertThat(found.get(0), instanceOf(MissingNamespaceNameIssue.class));
		assertThat(found.get(1), instanceOf(UndefinedNamespaceIssue.class));
		assertThat(found.get(2), instanceOf(NakedNameIssue.class));
	}

	@Test
	public void testBuiltinNamesAreNotLookedUp() throws Exception {
		assertTrue(issues("act(p(HGNC:AKT1, pmod(Ph, Ser, 473)), ma(kin))").isEmpty());
	}

	@Test
	public void testNakedNamesWhenAllowed() throws ParseFailureException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		BelNode node = BelTermParser.readTerm(new LexicalContext(1, "p(AKT1)"))
				.accept(new NodeCanonicalizer(ctx, new IdentifierResolver(VocabularyFixtures.permissive(), true)))
				.getNode();
		assertTrue(ctx.getIssues().isEmpty());
		assertThat(node.toBel(), is("p(dirty:AKT1)"));
	}
}
