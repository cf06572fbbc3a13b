package belc.trans;

import belc.VocabularyFixtures;
import belc.errors.TopLevelIssueContext;
import belc.model.graph.Concept;
import belc.model.term.IdentifierToken;
import belc.oracle.NamespaceOracle;
import belc.oracle.OracleException;
import belc.util.SourceLocation;
import org.junit.Before;
import org.junit.Test;

import java.util.Set;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class IdentifierResolverTest {

	private static final SourceLocation LOCATION = new SourceLocation(1, 2, 10);

	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		ctx = new TopLevelIssueContext();
	}

	private static IdentifierToken id(String namespace, String name) {
		return new IdentifierToken(LOCATION, namespace, name);
	}

	@Test
	public void testKnownName() {
		IdentifierResolver resolver = new IdentifierResolver(VocabularyFixtures.permissive(), false);
		assertThat(resolver.resolve(ctx, id("HGNC", "AKT1")), is(new Concept("HGNC", "AKT1")));
		assertThat(ctx.getIssues().size(), is(0));
	}

	@Test
	public void testBuiltinName() {
		IdentifierResolver resolver = new IdentifierResolver(VocabularyFixtures.permissive(), false);
		assertThat(resolver.resolve(ctx, IdentifierToken.builtin(LOCATION, "Ph")),
				is(new Concept(IdentifierToken.BEL_NAMESPACE, "Ph")));
		assertThat(ctx.getIssues().size(), is(0));
	}

	@Test
	public void testNakedName() {
		IdentifierResolver strict = new IdentifierResolver(VocabularyFixtures.permissive(), false);
		assertThat(strict.resolve(ctx, id(null, "AKT1")), is(new Concept(IdentifierResolver.NAKED_NAMESPACE, "AKT1")));
		assertThat(ctx.getIssues().get(0), instanceOf(NakedNameIssue.class));
		assertThat(ctx.getIssues().get(0).getLocation(), is(LOCATION));

		setUp();
		IdentifierResolver lenient = new IdentifierResolver(VocabularyFixtures.permissive(), true);
		assertTrue(lenient.allowsNakedNames());
		lenient.resolve(ctx, id(null, "AKT1"));
		lenient.resolve(ctx, id(IdentifierResolver.NAKED_NAMESPACE, "AKT1"));
		assertThat(ctx.getIssues().size(), is(0));
	}

	@Test
	public void testOracleFailure() {
		NamespaceOracle broken = new NamespaceOracle() {
			@Override
			public boolean isNamespaceDefined(String namespace) throws OracleException {
				throw new OracleException("vocabulary service unavailable");
			}

			@Override
			public boolean isMember(String namespace, String name) throws OracleException {
				throw new OracleException("vocabulary service unavailable");
			}

			@Override
			public boolean isAnnotationDefined(String keyword) {
				return false;
			}

			@Override
			public Set<String> annotationValues(String keyword) {
				throw new UnsupportedOperationException();
			}
		};
		Concept concept = new IdentifierResolver(broken, false).resolve(ctx, id("HGNC", "AKT1"));
		assertThat(concept, is(new Concept("HGNC", "AKT1")));
		assertThat(ctx.getIssues().get(0), instanceOf(OracleFailureIssue.class));
		assertTrue(ctx.hasErrors());
	}
}
