package belc.trans;

import belc.errors.IssueContext;
import belc.model.metadata.Definition;
import belc.model.metadata.DefinitionToken;
import belc.model.metadata.DocumentMetadata;
import belc.model.metadata.DocumentPropertyToken;
import belc.model.metadata.MetadataToken;
import belc.model.metadata.MetadataTokenVisitor;
import belc.parser.BelMetadataParser;
import belc.parser.LexicalContext;
import belc.parser.ParseFailureException;
import com.google.common.collect.ImmutableSet;

import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Collects the document properties and keyword definitions of a definitions section into a
 * {@link DocumentMetadata}.
 */
public class MetadataParser {

	private static final Logger logger = Logger.getLogger("MetadataParser");

	public static final Set<String> DOCUMENT_KEYS = ImmutableSet.of(
			DocumentMetadata.NAME, DocumentMetadata.VERSION, "Description", "Authors", "ContactInfo", "Licenses",
			"Copyright", "Disclaimer");

	private final DocumentMetadata metadata;

	public MetadataParser(DocumentMetadata metadata) {
		this.metadata = metadata;
	}

	public DocumentMetadata getMetadata() {
		return metadata;
	}

	public void processLine(IssueContext ctx, int lineNumber, String line) {
		MetadataToken token;
		try {
			token = BelMetadataParser.readMetadata(new LexicalContext(lineNumber, line.trim()));
		} catch (ParseFailureException e) {
			ctx.report(new GrammarIssue("metadata", e));
			return;
		}
		process(ctx, token);
	}

	public void process(IssueContext ctx, MetadataToken token) {
		token.accept(new MetadataTokenVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(DocumentPropertyToken documentPropertyToken) {
				if(!DOCUMENT_KEYS.contains(documentPropertyToken.getKey())) {
					ctx.report(new MalformedMetadataIssue(documentPropertyToken.getLocation(),
							"unknown document property " + documentPropertyToken.getKey()));
					return null;
				}
				metadata.setProperty(documentPropertyToken.getKey(), documentPropertyToken.getValue());
				return null;
			}

			@Override
			public Void visit(DefinitionToken definitionToken) {
				Definition definition = definitionToken.getDefinition();
				if(definition.getKind() == Definition.Kind.PATTERN) {
					try {
						Pattern.compile(definition.getValue());
					} catch (PatternSyntaxException e) {
						ctx.report(new MalformedMetadataIssue(definitionToken.getLocation(),
								"invalid pattern for " + definition.getKeyword() + ": " + e.getDescription()));
						return null;
					}
				}
				Definition previous;
				String kind;
				if(definitionToken.getTarget() == DefinitionToken.Target.NAMESPACE) {
					previous = metadata.defineNamespace(definition);
					kind = "namespace";
				} else {
					previous = metadata.defineAnnotation(definition);
					kind = "annotation";
				}
				logger.fine("defined " + kind + " " + definition.getKeyword() + " as " + definition.getKind());
				if(previous != null) {
					ctx.report(new RedefinedKeywordIssue(definitionToken.getLocation(), kind, definition.getKeyword()));
				}
				return null;
			}
		});
	}
}
