package belc.parser;

import belc.model.BelRelation;
import belc.model.statement.*;
import belc.model.term.TermToken;

import java.util.Arrays;
import java.util.Collections;

import static belc.parser.BelLexicalGrammars.*;
import static belc.parser.ParseTools.*;

/**
 * Parses one statement line: a single term, {@code subject relation object}, a nested statement (parsed so it can
 * be rejected precisely), or a {@code hasMembers}/{@code hasComponents} list statement.
 */
public final class BelStatementParser {

	private BelStatementParser() {}

	static final Grammar<Located<BelRelation>> RELATION = ws(matchStringOneOf(BelRelation.allTokens()))
			.map(token -> new Located<>(token.getLocation(), BelRelation.fromToken(token.getValue())));

	static final Grammar<RelationStatementToken> RELATION_STATEMENT = emptySequence()
			.part(BelTermParser.TERM)
			.part(RELATION)
			.part(BelTermParser.TERM)
			.map(seq -> new RelationStatementToken(seq.getLocation(),
					seq.getValue().getRest().getRest().getFirst(),
					seq.getValue().getRest().getFirst().getValue(),
					seq.getValue().getFirst()));

	static final Grammar<StatementToken> NESTED_STATEMENT = emptySequence()
			.part(BelTermParser.TERM)
			.part(RELATION)
			.drop(token("("))
			.part(RELATION_STATEMENT)
			.drop(token(")"))
			.map(seq -> new NestedStatementToken(seq.getLocation(),
					seq.getValue().getRest().getRest().getFirst(),
					seq.getValue().getRest().getFirst().getValue(),
					seq.getValue().getFirst()));

	private static final Grammar<Located<BelRelation>> LIST_RELATION = keyword(Arrays.asList("hasMembers", "hasComponents"))
			.map(token -> new Located<>(token.getLocation(),
					"hasMembers".equals(token.getValue()) ? BelRelation.HAS_MEMBER : BelRelation.HAS_COMPONENT));

	static final Grammar<StatementToken> LIST_STATEMENT = emptySequence()
			.part(BelTermParser.TERM)
			.part(LIST_RELATION)
			.drop(functionOpen(Collections.singletonList("list")))
			.part(BelTermParser.ABUNDANCE_LIST)
			.drop(token(")"))
			.map(seq -> new ListStatementToken(seq.getLocation(),
					seq.getValue().getRest().getRest().getFirst(),
					seq.getValue().getRest().getFirst().getValue(),
					seq.getValue().getFirst().getItems()));

	static final Grammar<StatementToken> TERM_STATEMENT = BelTermParser.TERM
			.map(term -> new TermStatementToken(term.getLocation(), term));

	public static final Grammar<StatementToken> STATEMENT = ParseTools.<StatementToken>parseOneOf(
			LIST_STATEMENT,
			NESTED_STATEMENT,
			RELATION_STATEMENT,
			TERM_STATEMENT);

	public static StatementToken readStatement(LexicalContext ctx) throws ParseFailureException {
		return readOrExcept(ctx, STATEMENT);
	}

	/**
	 * Parses a line holding just one term, as written by the footer of a canonical document.
	 */
	public static TermToken readTerm(LexicalContext ctx) throws ParseFailureException {
		return BelTermParser.readTerm(ctx);
	}
}
