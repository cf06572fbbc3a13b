package belc.parser;

import belc.model.BelRelation;
import belc.model.statement.RelationStatementToken;
import belc.model.statement.StatementToken;
import belc.model.term.SimpleAbundanceToken;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class BelRelationTokenTest {

	@Parameterized.Parameters(name = "{0}")
	public static List<Object[]> data() {
		List<Object[]> data = new ArrayList<>();
		for(BelRelation relation : BelRelation.values()) {
			for(String token : relation.getTokens()) {
				data.add(new Object[] {token, relation});
			}
		}
		return data;
	}

	private final String token;
	private final BelRelation expected;

	public BelRelationTokenTest(String token, BelRelation expected) {
		this.token = token;
		this.expected = expected;
	}

	private static StatementToken parse(String text) throws ParseFailureException {
		return BelStatementParser.readStatement(new LexicalContext(1, text));
	}

	@Test
	public void testRelationToken() throws ParseFailureException {
		StatementToken statement = parse("p(HGNC:AKT1) " + token + " p(HGNC:TP53)");
		assertThat(statement, instanceOf(RelationStatementToken.class));
		RelationStatementToken relation = (RelationStatementToken) statement;
		assertThat(relation.getRelation(), is(expected));
		assertThat(((SimpleAbundanceToken) relation.getSubject()).getIdentifier().getName(), is("AKT1"));
		assertThat(((SimpleAbundanceToken) relation.getObject()).getIdentifier().getName(), is("TP53"));
	}

	@Test
	public void testRelationTokenWithoutSpaces() throws ParseFailureException {
		// symbolic tokens may be written right against the terms
		if(Character.isLetter(token.charAt(0))) {
			return;
		}
		RelationStatementToken relation = (RelationStatementToken) parse("p(HGNC:AKT1)" + token + "p(HGNC:TP53)");
		assertThat(relation.getRelation(), is(expected));
	}
}
