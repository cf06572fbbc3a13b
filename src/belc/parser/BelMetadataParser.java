package belc.parser;

import belc.model.metadata.Definition;
import belc.model.metadata.DefinitionToken;
import belc.model.metadata.DocumentPropertyToken;
import belc.model.metadata.MetadataToken;

import java.util.Arrays;
import java.util.Collections;
import java.util.regex.Pattern;

import static belc.parser.BelLexicalGrammars.*;
import static belc.parser.ParseTools.*;

/**
 * The grammar of the definitions section: {@code SET DOCUMENT}, {@code DEFINE NAMESPACE} and
 * {@code DEFINE ANNOTATION} lines.
 */
public final class BelMetadataParser {

	private BelMetadataParser() {}

	private static final Pattern KEYWORD_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

	static final Grammar<Located<String>> DEFINED_KEYWORD = ws(matchPatternText(KEYWORD_PATTERN));

	static final Grammar<MetadataToken> DOCUMENT_PROPERTY = emptySequence()
			.drop(keyword(Collections.singletonList("SET")))
			.drop(keyword(Collections.singletonList("DOCUMENT")))
			.part(DEFINED_KEYWORD)
			.drop(token("="))
			.part(name())
			.map(seq -> new DocumentPropertyToken(seq.getLocation(),
					seq.getValue().getRest().getFirst().getValue(), seq.getValue().getFirst().getValue()));

	private static Grammar<MetadataToken> definition(DefinitionToken.Target target, boolean allowList) {
		Grammar<Located<String>> prefix = emptySequence()
				.drop(keyword(Collections.singletonList("DEFINE")))
				.drop(keyword(Collections.singletonList(target.name())))
				.part(DEFINED_KEYWORD)
				.drop(keyword(Collections.singletonList("AS")))
				.map(seq -> seq.getValue().getFirst());
		Grammar<MetadataToken> url = emptySequence()
				.part(prefix)
				.drop(keyword(Collections.singletonList("URL")))
				.part(quotedString())
				.map(seq -> new DefinitionToken(seq.getLocation(), target, Definition.url(
						seq.getValue().getRest().getFirst().getValue(), seq.getValue().getFirst().getValue())));
		Grammar<MetadataToken> pattern = emptySequence()
				.part(prefix)
				.drop(keyword(Collections.singletonList("PATTERN")))
				.part(quotedString())
				.map(seq -> new DefinitionToken(seq.getLocation(), target, Definition.pattern(
						seq.getValue().getRest().getFirst().getValue(), seq.getValue().getFirst().getValue())));
		if(!allowList) {
			return parseOneOf(url, pattern);
		}
		Grammar<MetadataToken> list = emptySequence()
				.part(prefix)
				.drop(keyword(Collections.singletonList("LIST")))
				.part(delimitedSet())
				.map(seq -> new DefinitionToken(seq.getLocation(), target, Definition.list(
						seq.getValue().getRest().getFirst().getValue(), values(seq.getValue().getFirst()))));
		return parseOneOf(Arrays.asList(url, pattern, list));
	}

	static final Grammar<MetadataToken> NAMESPACE_DEFINITION = definition(DefinitionToken.Target.NAMESPACE, false);
	static final Grammar<MetadataToken> ANNOTATION_DEFINITION = definition(DefinitionToken.Target.ANNOTATION, true);

	public static final Grammar<MetadataToken> METADATA = parseOneOf(
			DOCUMENT_PROPERTY, NAMESPACE_DEFINITION, ANNOTATION_DEFINITION);

	public static MetadataToken readMetadata(LexicalContext ctx) throws ParseFailureException {
		return readOrExcept(ctx, METADATA);
	}

	/**
	 * @return whether {@param line} belongs to the definitions section, judging only by its leading keywords
	 */
	public static boolean isMetadataLine(String line) {
		return line.startsWith("SET DOCUMENT ") || line.startsWith("DEFINE NAMESPACE ") ||
				line.startsWith("DEFINE ANNOTATION ");
	}
}
