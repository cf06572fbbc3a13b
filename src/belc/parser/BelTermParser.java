package belc.parser;

import belc.model.BelFunction;
import belc.model.BuiltinLabels;
import belc.model.graph.TranslocationKind;
import belc.model.term.*;
import belc.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import static belc.parser.BelLexicalGrammars.*;
import static belc.parser.ParseTools.*;

/**
 * <p>
 * A backtracking parser for BEL terms: abundances, their variants and fusions, complexes, composites, reactions,
 * and the activity, degradation and translocation functions that may wrap them.
 * </p>
 *
 * <p>
 * The grammar is assembled once, leaf first, in static fields. Legacy BEL 1.0 spellings are accepted and normalized
 * to BEL 2.0 tokens while parsing; such tokens remember the legacy text so that the normalization can be reported.
 * Start reading at {@link #TERM}.
 * </p>
 */
public final class BelTermParser {

	private BelTermParser() {}

	private static final Grammar<Located<Void>> COMMA = token(",");
	private static final Grammar<Located<Void>> CLOSE = token(")");

	static final Grammar<IdentifierToken> IDENTIFIER = identifier();
	static final Grammar<IdentifierToken> QUALIFIED_IDENTIFIER = qualifiedIdentifier();

	// loc(NS:name)
	static final Grammar<IdentifierToken> LOCATION = emptySequence()
			.drop(functionOpen(Arrays.asList("loc", "location")))
			.part(IDENTIFIER)
			.drop(CLOSE)
			.map(seq -> seq.getValue().getFirst());

	// the optional trailing ", loc(...)" of an abundance; absent locations are yielded as null
	private static final Grammar<Located<IdentifierToken>> OPTIONAL_LOCATION = cut(ParseTools.<Located<IdentifierToken>>parseOneOf(
			emptySequence()
					.drop(COMMA)
					.part(LOCATION)
					.map(seq -> new Located<IdentifierToken>(seq.getLocation(), seq.getValue().getFirst())),
			nop().map(v -> new Located<IdentifierToken>(v.getLocation(), null))));

	private static final Set<String> THREE_LETTER_AMINO_ACIDS = new HashSet<>(BuiltinLabels.AMINO_ACIDS.values());

	// three or one letter amino acid codes, yielded as three letter codes; X is kept so it can be reported
	static final Grammar<Located<String>> AMINO_ACID;
	static {
		List<String> codes = new ArrayList<>(THREE_LETTER_AMINO_ACIDS);
		codes.addAll(BuiltinLabels.AMINO_ACIDS.keySet());
		codes.add(ProteinModificationToken.PLACEHOLDER_CODE);
		AMINO_ACID = keyword(codes).map(code -> new Located<>(
				code.getLocation(), BuiltinLabels.AMINO_ACIDS.getOrDefault(code.getValue(), code.getValue())));
	}

	private static final Grammar<Located<String>> NUCLEOTIDE = ws(matchPatternText(
			Pattern.compile("[" + BuiltinLabels.DNA_NUCLEOTIDES + "](?![A-Za-z0-9_])")));

	/**
	 * A name from a built-in BEL vocabulary. Qualified names are kept as they are; bare names known to
	 * {@param labels} become names of the {@code bel} namespace; bare names only known to {@param legacyLabels} do
	 * too, remembering their legacy spelling; other bare names are left without a namespace.
	 */
	private static Grammar<Located<LabelToken>> builtinLabel(Map<String, String> labels, Map<String, String> legacyLabels) {
		return cut(ParseTools.<Located<LabelToken>>parseOneOf(
				QUALIFIED_IDENTIFIER.map(id -> new Located<>(id.getLocation(), new LabelToken(id, null))),
				name().map(n -> {
					SourceLocation location = n.getLocation();
					String label = n.getValue();
					if(labels.containsKey(label)) {
						return new Located<>(location, new LabelToken(
								IdentifierToken.builtin(location, labels.get(label)), null));
					}
					if(legacyLabels.containsKey(label)) {
						return new Located<>(location, new LabelToken(
								IdentifierToken.builtin(location, legacyLabels.get(label)), label));
					}
					return new Located<>(location, new LabelToken(new IdentifierToken(location, null, label), null));
				})));
	}

	private static final class LabelToken {
		private final IdentifierToken identifier;
		private final String legacySyntax;

		LabelToken(IdentifierToken identifier, String legacySyntax) {
			this.identifier = identifier;
			this.legacySyntax = legacySyntax;
		}
	}

	// var("p.Ala1Thr")
	static final Grammar<VariantToken> HGVS = emptySequence()
			.drop(functionOpen(Arrays.asList("var", "variant")))
			.part(quotedString())
			.drop(CLOSE)
			.map(seq -> new HgvsToken(seq.getLocation(), seq.getValue().getFirst().getValue(), null));

	private static final Grammar<Located<LabelToken>> PMOD_LABEL = builtinLabel(
			BuiltinLabels.PROTEIN_MODIFICATIONS, BuiltinLabels.LEGACY_PROTEIN_MODIFICATIONS);
	private static final Grammar<Located<String>> PMOD_OPEN = functionOpen(Arrays.asList("pmod", "proteinModification"));

	private static String legacyPmod(LabelToken label) {
		return label.legacySyntax == null ? null : "pmod(" + label.legacySyntax + ")";
	}

	// pmod(label[, code[, position]])
	static final Grammar<VariantToken> PMOD = cut(ParseTools.<VariantToken>parseOneOf(
			emptySequence()
					.drop(PMOD_OPEN)
					.part(PMOD_LABEL)
					.drop(COMMA)
					.part(AMINO_ACID)
					.drop(COMMA)
					.part(integer())
					.drop(CLOSE)
					.map(seq -> {
						LabelToken label = seq.getValue().getRest().getRest().getFirst().getValue();
						return new ProteinModificationToken(seq.getLocation(), label.identifier,
								seq.getValue().getRest().getFirst().getValue(), seq.getValue().getFirst().getValue(),
								legacyPmod(label));
					}),
			emptySequence()
					.drop(PMOD_OPEN)
					.part(PMOD_LABEL)
					.drop(COMMA)
					.part(AMINO_ACID)
					.drop(CLOSE)
					.map(seq -> {
						LabelToken label = seq.getValue().getRest().getFirst().getValue();
						return new ProteinModificationToken(seq.getLocation(), label.identifier,
								seq.getValue().getFirst().getValue(), null, legacyPmod(label));
					}),
			emptySequence()
					.drop(PMOD_OPEN)
					.part(PMOD_LABEL)
					.drop(CLOSE)
					.map(seq -> {
						LabelToken label = seq.getValue().getFirst().getValue();
						return new ProteinModificationToken(seq.getLocation(), label.identifier, null, null,
								legacyPmod(label));
					})));

	// gmod(Me) or gmod(NS:name)
	static final Grammar<VariantToken> GMOD = emptySequence()
			.drop(functionOpen(Arrays.asList("gmod", "geneModification")))
			.part(builtinLabel(BuiltinLabels.GENE_MODIFICATIONS, BuiltinLabels.LEGACY_GENE_MODIFICATIONS))
			.drop(CLOSE)
			.map(seq -> new GeneModificationToken(seq.getLocation(), seq.getValue().getFirst().getValue().identifier));

	// "5_20", 5_20 or "?"; group 2 and 3 are start and stop, both absent for the unknown fragment
	private static final Pattern FRAGMENT_RANGE = Pattern.compile(
			"(\"?)(?:([0-9]+|\\?)_([0-9]+|\\?|\\*)|\\?)\\1");

	private static final Grammar<Located<MatchResult>> FRAGMENT_RANGE_GRAMMAR = ws(matchPattern(FRAGMENT_RANGE));
	private static final Grammar<Located<String>> FRAGMENT_OPEN = functionOpen(Arrays.asList("frag", "fragment"));

	// frag("5_20"[, "description"])
	static final Grammar<VariantToken> FRAGMENT = cut(ParseTools.<VariantToken>parseOneOf(
			emptySequence()
					.drop(FRAGMENT_OPEN)
					.part(FRAGMENT_RANGE_GRAMMAR)
					.drop(COMMA)
					.part(quotedString())
					.drop(CLOSE)
					.map(seq -> {
						MatchResult range = seq.getValue().getRest().getFirst().getValue();
						return new FragmentToken(seq.getLocation(), range.group(2), range.group(3),
								seq.getValue().getFirst().getValue());
					}),
			emptySequence()
					.drop(FRAGMENT_OPEN)
					.part(FRAGMENT_RANGE_GRAMMAR)
					.drop(CLOSE)
					.map(seq -> {
						MatchResult range = seq.getValue().getFirst().getValue();
						return new FragmentToken(seq.getLocation(), range.group(2), range.group(3), null);
					})));

	private static final Grammar<Located<String>> SUBSTITUTION_OPEN = functionOpen(Arrays.asList("sub", "substitution"));

	// BEL 1.0 sub(R, 275, H) on proteins, normalized to var("p.Arg275His")
	static final Grammar<VariantToken> PROTEIN_SUBSTITUTION = emptySequence()
			.drop(SUBSTITUTION_OPEN)
			.part(AMINO_ACID)
			.drop(COMMA)
			.part(integer())
			.drop(COMMA)
			.part(AMINO_ACID)
			.drop(CLOSE)
			.map(seq -> {
				String reference = seq.getValue().getRest().getRest().getFirst().getValue();
				int position = seq.getValue().getRest().getFirst().getValue();
				String variant = seq.getValue().getFirst().getValue();
				return new HgvsToken(seq.getLocation(), "p." + reference + position + variant,
						"sub(" + reference + ", " + position + ", " + variant + ")");
			});

	// BEL 1.0 sub(G, 275341, C) on genes, normalized to var("c.275341G>C")
	static final Grammar<VariantToken> GENE_SUBSTITUTION = emptySequence()
			.drop(SUBSTITUTION_OPEN)
			.part(NUCLEOTIDE)
			.drop(COMMA)
			.part(integer())
			.drop(COMMA)
			.part(NUCLEOTIDE)
			.drop(CLOSE)
			.map(seq -> {
				String reference = seq.getValue().getRest().getRest().getFirst().getValue();
				int position = seq.getValue().getRest().getFirst().getValue();
				String variant = seq.getValue().getFirst().getValue();
				return new HgvsToken(seq.getLocation(), "c." + position + reference + ">" + variant,
						"sub(" + reference + ", " + position + ", " + variant + ")");
			});

	// BEL 1.0 trunc(40), normalized to var("p.40*")
	static final Grammar<VariantToken> TRUNCATION = emptySequence()
			.drop(functionOpen(Arrays.asList("trunc", "truncation")))
			.part(integer())
			.drop(CLOSE)
			.map(seq -> {
				int position = seq.getValue().getFirst().getValue();
				return new HgvsToken(seq.getLocation(), "p." + position + "*", "trunc(" + position + ")");
			});

	// "p.1_79" or "?"
	private static final Pattern FUSION_RANGE = Pattern.compile(
			"\"(?:([a-z])\\.([0-9]+|\\?)_([0-9]+|\\?|\\*)|\\?)\"");

	static final Grammar<FusionRangeToken> FUSION_RANGE_GRAMMAR = ws(matchPattern(FUSION_RANGE)
			.map(m -> {
				MatchResult range = m.getValue();
				if(range.group(1) == null) {
					return FusionRangeToken.missing(m.getLocation());
				}
				return new FusionRangeToken(m.getLocation(), range.group(1), range.group(2), range.group(3));
			}));

	private static final Grammar<Located<String>> FUSION_OPEN = functionOpen(Arrays.asList("fus", "fusion"));

	private static final class FusionParts {
		private final IdentifierToken partner5p;
		private final FusionRangeToken range5p;
		private final IdentifierToken partner3p;
		private final FusionRangeToken range3p;
		private final String legacySyntax;

		FusionParts(IdentifierToken partner5p, FusionRangeToken range5p, IdentifierToken partner3p,
		            FusionRangeToken range3p, String legacySyntax) {
			this.partner5p = partner5p;
			this.range5p = range5p;
			this.partner3p = partner3p;
			this.range3p = range3p;
			this.legacySyntax = legacySyntax;
		}
	}

	// fus(NS:a, "p.1_79", NS:b, "p.312_1500")
	private static final Grammar<Located<FusionParts>> FUSION = emptySequence()
			.drop(FUSION_OPEN)
			.part(IDENTIFIER)
			.drop(COMMA)
			.part(FUSION_RANGE_GRAMMAR)
			.drop(COMMA)
			.part(IDENTIFIER)
			.drop(COMMA)
			.part(FUSION_RANGE_GRAMMAR)
			.drop(CLOSE)
			.map(seq -> new Located<>(seq.getLocation(), new FusionParts(
					seq.getValue().getRest().getRest().getRest().getFirst(),
					seq.getValue().getRest().getRest().getFirst(),
					seq.getValue().getRest().getFirst(),
					seq.getValue().getFirst(),
					null)));

	private static final class LegacyFusion {
		private final IdentifierToken partner3p;
		private final Integer start;
		private final Integer stop;

		LegacyFusion(IdentifierToken partner3p, Integer start, Integer stop) {
			this.partner3p = partner3p;
			this.start = start;
			this.stop = stop;
		}
	}

	// the BEL 1.0 fus(NS:b[, start, stop]) that follows the 5' partner
	private static final Grammar<Located<LegacyFusion>> LEGACY_FUSION = cut(ParseTools.<Located<LegacyFusion>>parseOneOf(
			emptySequence()
					.drop(FUSION_OPEN)
					.part(IDENTIFIER)
					.drop(COMMA)
					.part(integer())
					.drop(COMMA)
					.part(integer())
					.drop(CLOSE)
					.map(seq -> new Located<>(seq.getLocation(), new LegacyFusion(
							seq.getValue().getRest().getRest().getFirst(),
							seq.getValue().getRest().getFirst().getValue(),
							seq.getValue().getFirst().getValue()))),
			emptySequence()
					.drop(FUSION_OPEN)
					.part(IDENTIFIER)
					.drop(CLOSE)
					.map(seq -> new Located<>(seq.getLocation(), new LegacyFusion(
							seq.getValue().getFirst(), null, null)))));

	private static String fusionReference(BelFunction function) {
		switch (function) {
			case GENE:
				return "c";
			case RNA:
			case MIRNA:
				return "r";
			default:
				return "p";
		}
	}

	private static FusionParts normalizeLegacyFusion(BelFunction function, IdentifierToken partner5p,
	                                                 Located<LegacyFusion> located) {
		LegacyFusion legacy = located.getValue();
		SourceLocation location = located.getLocation();
		String legacySyntax;
		FusionRangeToken range5p;
		FusionRangeToken range3p;
		if(legacy.start == null) {
			legacySyntax = "fus(" + legacy.partner3p + ")";
			range5p = FusionRangeToken.missing(location);
			range3p = FusionRangeToken.missing(location);
		} else {
			legacySyntax = "fus(" + legacy.partner3p + ", " + legacy.start + ", " + legacy.stop + ")";
			String reference = fusionReference(function);
			range5p = new FusionRangeToken(location, reference, "?", legacy.start.toString());
			range3p = new FusionRangeToken(location, reference, legacy.stop.toString(), "?");
		}
		return new FusionParts(partner5p, range5p, legacy.partner3p, range3p, legacySyntax);
	}

	static final ReferenceGrammar<AbundanceToken> ABUNDANCE = new ReferenceGrammar<>();

	static final Grammar<LocatedList<AbundanceToken>> ABUNDANCE_LIST = parseListOf(ABUNDANCE, COMMA);

	/**
	 * {@code fn(identifier[, loc(...)])}
	 */
	private static Grammar<AbundanceToken> simpleAbundance(BelFunction function, boolean allowLocation) {
		Grammar<Located<String>> open = functionOpen(function.getKeywords());
		if(!allowLocation) {
			return emptySequence()
					.drop(open)
					.part(IDENTIFIER)
					.drop(CLOSE)
					.map(seq -> new SimpleAbundanceToken(seq.getLocation(), function, seq.getValue().getFirst(), null));
		}
		return emptySequence()
				.drop(open)
				.part(IDENTIFIER)
				.part(OPTIONAL_LOCATION)
				.drop(CLOSE)
				.map(seq -> new SimpleAbundanceToken(seq.getLocation(), function,
						seq.getValue().getRest().getFirst(), seq.getValue().getFirst().getValue()));
	}

	/**
	 * The gene, RNA, miRNA and protein forms: plain, with variants, or as fusions.
	 */
	private static Grammar<AbundanceToken> centralDogmaAbundance(BelFunction function, Grammar<VariantToken> variant,
	                                                             boolean allowFusion) {
		Grammar<Located<String>> open = functionOpen(function.getKeywords());
		List<Grammar<? extends AbundanceToken>> options = new ArrayList<>();
		options.add(simpleAbundance(function, true));
		options.add(emptySequence()
				.drop(open)
				.part(IDENTIFIER)
				.drop(COMMA)
				.part(parseListOf(variant, COMMA))
				.part(OPTIONAL_LOCATION)
				.drop(CLOSE)
				.map(seq -> new VariantAbundanceToken(seq.getLocation(), function,
						seq.getValue().getRest().getRest().getFirst(),
						seq.getValue().getRest().getFirst().getItems(),
						seq.getValue().getFirst().getValue())));
		if(allowFusion) {
			options.add(emptySequence()
					.drop(open)
					.part(FUSION)
					.part(OPTIONAL_LOCATION)
					.drop(CLOSE)
					.map(seq -> {
						FusionParts parts = seq.getValue().getRest().getFirst().getValue();
						return new FusionAbundanceToken(seq.getLocation(), function, parts.partner5p, parts.range5p,
								parts.partner3p, parts.range3p, seq.getValue().getFirst().getValue(), null);
					}));
			options.add(emptySequence()
					.drop(open)
					.part(IDENTIFIER)
					.drop(COMMA)
					.part(LEGACY_FUSION)
					.part(OPTIONAL_LOCATION)
					.drop(CLOSE)
					.map(seq -> {
						FusionParts parts = normalizeLegacyFusion(function,
								seq.getValue().getRest().getRest().getFirst(), seq.getValue().getRest().getFirst());
						return new FusionAbundanceToken(seq.getLocation(), function, parts.partner5p, parts.range5p,
								parts.partner3p, parts.range3p, seq.getValue().getFirst().getValue(),
								parts.legacySyntax);
					}));
		}
		return cut(parseOneOf(options));
	}

	// complex(NS:name) or complex(member, member, ...), either with an optional location
	static final Grammar<AbundanceToken> COMPLEX;
	static {
		Grammar<Located<String>> open = functionOpen(BelFunction.COMPLEX.getKeywords());
		COMPLEX = cut(ParseTools.<AbundanceToken>parseOneOf(
				simpleAbundance(BelFunction.COMPLEX, true),
				emptySequence()
						.drop(open)
						.part(ABUNDANCE_LIST)
						.part(OPTIONAL_LOCATION)
						.drop(CLOSE)
						.map(seq -> new ListAbundanceToken(seq.getLocation(), BelFunction.COMPLEX,
								seq.getValue().getRest().getFirst().getItems(), seq.getValue().getFirst().getValue()))));
	}

	static final Grammar<AbundanceToken> COMPOSITE = emptySequence()
			.drop(functionOpen(BelFunction.COMPOSITE.getKeywords()))
			.part(ABUNDANCE_LIST)
			.part(OPTIONAL_LOCATION)
			.drop(CLOSE)
			.map(seq -> new ListAbundanceToken(seq.getLocation(), BelFunction.COMPOSITE,
					seq.getValue().getRest().getFirst().getItems(), seq.getValue().getFirst().getValue()));

	// rxn(reactants(...), products(...))
	static final Grammar<AbundanceToken> REACTION = emptySequence()
			.drop(functionOpen(BelFunction.REACTION.getKeywords()))
			.drop(functionOpen(Collections.singletonList("reactants")))
			.part(ABUNDANCE_LIST)
			.drop(CLOSE)
			.drop(COMMA)
			.drop(functionOpen(Collections.singletonList("products")))
			.part(ABUNDANCE_LIST)
			.drop(CLOSE)
			.drop(CLOSE)
			.map(seq -> new ReactionToken(seq.getLocation(),
					seq.getValue().getRest().getFirst().getItems(), seq.getValue().getFirst().getItems()));

	static {
		ABUNDANCE.setReferencedGrammar(memoize(ParseTools.<AbundanceToken>parseOneOf(
				simpleAbundance(BelFunction.ABUNDANCE, true),
				centralDogmaAbundance(BelFunction.GENE,
						ParseTools.<VariantToken>parseOneOf(HGVS, GMOD, GENE_SUBSTITUTION), true),
				centralDogmaAbundance(BelFunction.RNA, HGVS, true),
				centralDogmaAbundance(BelFunction.MIRNA, HGVS, false),
				centralDogmaAbundance(BelFunction.PROTEIN,
						ParseTools.<VariantToken>parseOneOf(PMOD, HGVS, FRAGMENT, PROTEIN_SUBSTITUTION, TRUNCATION), true),
				COMPLEX,
				COMPOSITE,
				simpleAbundance(BelFunction.BIOLOGICAL_PROCESS, false),
				simpleAbundance(BelFunction.PATHOLOGY, false),
				REACTION)));
	}

	private static final Grammar<Located<String>> ACTIVITY_OPEN = functionOpen(Arrays.asList("act", "activity"));

	// ma(kin), ma(kinaseActivity) or ma(NS:name)
	static final Grammar<IdentifierToken> MOLECULAR_ACTIVITY = emptySequence()
			.drop(functionOpen(Arrays.asList("ma", "molecularActivity")))
			.part(builtinLabel(BuiltinLabels.ACTIVITIES, Collections.emptyMap()))
			.drop(CLOSE)
			.map(seq -> seq.getValue().getFirst().getValue().identifier);

	static final Grammar<TermToken> ACTIVITY = cut(ParseTools.<TermToken>parseOneOf(
			emptySequence()
					.drop(ACTIVITY_OPEN)
					.part(ABUNDANCE)
					.drop(COMMA)
					.part(MOLECULAR_ACTIVITY)
					.drop(CLOSE)
					.map(seq -> new ActivityToken(seq.getLocation(), seq.getValue().getRest().getFirst(),
							seq.getValue().getFirst(), null)),
			emptySequence()
					.drop(ACTIVITY_OPEN)
					.part(ABUNDANCE)
					.drop(CLOSE)
					.map(seq -> new ActivityToken(seq.getLocation(), seq.getValue().getFirst(), null, null))));

	// BEL 1.0 kin(p(X)), normalized to act(p(X), ma(kin))
	static final Grammar<TermToken> LEGACY_ACTIVITY;
	static {
		Set<String> legacyFunctions = new HashSet<>(BuiltinLabels.ACTIVITIES.keySet());
		legacyFunctions.remove("molecularActivity");
		LEGACY_ACTIVITY = emptySequence()
				.part(functionOpen(legacyFunctions))
				.part(ABUNDANCE)
				.drop(CLOSE)
				.map(seq -> {
					Located<String> function = seq.getValue().getRest().getFirst();
					return new ActivityToken(seq.getLocation(), seq.getValue().getFirst(),
							IdentifierToken.builtin(function.getLocation(),
									BuiltinLabels.ACTIVITIES.get(function.getValue())),
							function.getValue() + "(...)");
				});
	}

	static final Grammar<TermToken> DEGRADATION = emptySequence()
			.drop(functionOpen(Arrays.asList("deg", "degradation")))
			.part(ABUNDANCE)
			.drop(CLOSE)
			.map(seq -> new DegradationToken(seq.getLocation(), seq.getValue().getFirst()));

	private static final Grammar<Located<String>> TRANSLOCATION_OPEN = functionOpen(Arrays.asList("tloc", "translocation"));

	static final Grammar<TermToken> TRANSLOCATION = cut(ParseTools.<TermToken>parseOneOf(
			emptySequence()
					.drop(TRANSLOCATION_OPEN)
					.part(ABUNDANCE)
					.drop(COMMA)
					.drop(functionOpen(Arrays.asList("fromLoc", "fromLocation")))
					.part(IDENTIFIER)
					.drop(CLOSE)
					.drop(COMMA)
					.drop(functionOpen(Arrays.asList("toLoc", "toLocation")))
					.part(IDENTIFIER)
					.drop(CLOSE)
					.drop(CLOSE)
					.map(seq -> new TranslocationToken(seq.getLocation(),
							seq.getValue().getRest().getRest().getFirst(), TranslocationKind.TRANSLOCATION,
							seq.getValue().getRest().getFirst(), seq.getValue().getFirst(), null)),
			emptySequence()
					.drop(TRANSLOCATION_OPEN)
					.part(ABUNDANCE)
					.drop(COMMA)
					.part(IDENTIFIER)
					.drop(COMMA)
					.part(IDENTIFIER)
					.drop(CLOSE)
					.map(seq -> {
						IdentifierToken from = seq.getValue().getRest().getFirst();
						IdentifierToken to = seq.getValue().getFirst();
						return new TranslocationToken(seq.getLocation(), seq.getValue().getRest().getRest().getFirst(),
								TranslocationKind.TRANSLOCATION, from, to, "tloc(..., " + from + ", " + to + ")");
					}),
			emptySequence()
					.drop(TRANSLOCATION_OPEN)
					.part(ABUNDANCE)
					.drop(CLOSE)
					.map(seq -> new TranslocationToken(seq.getLocation(), seq.getValue().getFirst(),
							TranslocationKind.TRANSLOCATION, null, null, null))));

	private static Grammar<TermToken> translocationShorthand(TranslocationKind kind, String longName) {
		return emptySequence()
				.drop(functionOpen(Arrays.asList(kind.getKeyword(), longName)))
				.part(ABUNDANCE)
				.drop(CLOSE)
				.map(seq -> new TranslocationToken(seq.getLocation(), seq.getValue().getFirst(), kind, null, null, null));
	}

	static final Grammar<TermToken> SECRETION = translocationShorthand(TranslocationKind.SECRETION, "cellSecretion");
	static final Grammar<TermToken> SURFACE_EXPRESSION = translocationShorthand(
			TranslocationKind.SURFACE_EXPRESSION, "cellSurfaceExpression");

	public static final Grammar<TermToken> TERM = memoize(cut(ParseTools.<TermToken>parseOneOf(
			ABUNDANCE,
			ACTIVITY,
			LEGACY_ACTIVITY,
			DEGRADATION,
			TRANSLOCATION,
			SECRETION,
			SURFACE_EXPRESSION)));

	/**
	 * Parses a whole line as a single BEL term.
	 */
	public static TermToken readTerm(LexicalContext ctx) throws ParseFailureException {
		return readOrExcept(ctx, TERM);
	}
}
