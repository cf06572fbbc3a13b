package belc.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The relations of BEL statements. Each relation has one canonical name, used on output, and any number of
 * symbolic or legacy aliases accepted on input.
 */
public enum BelRelation {
	INCREASES("increases", "->", "→"),
	DIRECTLY_INCREASES("directlyIncreases", "=>", "⇒"),
	DECREASES("decreases", "-|"),
	DIRECTLY_DECREASES("directlyDecreases", "=|"),
	CAUSES_NO_CHANGE("causesNoChange", "cnc"),
	REGULATES("regulates", "reg"),
	RATE_LIMITING_STEP_OF("rateLimitingStepOf"),
	NEGATIVE_CORRELATION("negativeCorrelation", "neg"),
	POSITIVE_CORRELATION("positiveCorrelation", "pos"),
	ASSOCIATION("association", "--"),
	EQUIVALENT_TO("equivalentTo", "eq"),
	ANALOGOUS_TO("analogousTo"),
	ORTHOLOGOUS("orthologous"),
	BIOMARKER_FOR("biomarkerFor"),
	PROGNOSTIC_BIOMARKER_FOR("prognosticBiomarkerFor"),
	IS_A("isA"),
	PART_OF("partOf"),
	SUB_PROCESS_OF("subProcessOf"),
	TRANSCRIBED_TO("transcribedTo", ":>"),
	TRANSLATED_TO("translatedTo", ">>"),
	HAS_MEMBER("hasMember"),
	HAS_COMPONENT("hasComponent"),
	HAS_VARIANT("hasVariant"),
	HAS_REACTANT("hasReactant"),
	HAS_PRODUCT("hasProduct");

	private static final Set<BelRelation> SYMMETRIC = EnumSet.of(
			NEGATIVE_CORRELATION, POSITIVE_CORRELATION, ASSOCIATION, ORTHOLOGOUS, ANALOGOUS_TO, EQUIVALENT_TO);

	private static final Set<BelRelation> UNQUALIFIED = EnumSet.of(
			HAS_REACTANT, HAS_PRODUCT, HAS_COMPONENT, HAS_VARIANT, TRANSCRIBED_TO, TRANSLATED_TO, HAS_MEMBER, IS_A);

	// always recreated from node structure, so never written out as statements
	private static final Set<BelRelation> STRUCTURAL = EnumSet.of(HAS_REACTANT, HAS_PRODUCT, HAS_COMPONENT, HAS_VARIANT);

	private static final Map<String, BelRelation> BY_TOKEN = new HashMap<>();
	static {
		for(BelRelation relation : values()) {
			for(String token : relation.tokens) {
				BY_TOKEN.put(token, relation);
			}
		}
	}

	private final String canonicalName;
	private final List<String> tokens;

	BelRelation(String canonicalName, String... aliases) {
		this.canonicalName = canonicalName;
		String[] all = new String[aliases.length + 1];
		all[0] = canonicalName;
		System.arraycopy(aliases, 0, all, 1, aliases.length);
		this.tokens = Collections.unmodifiableList(Arrays.asList(all));
	}

	public String getCanonicalName() {
		return canonicalName;
	}

	public List<String> getTokens() {
		return tokens;
	}

	public boolean isSymmetric() {
		return SYMMETRIC.contains(this);
	}

	/**
	 * @return whether edges of this relation carry no citation, evidence or annotations
	 */
	public boolean isUnqualified() {
		return UNQUALIFIED.contains(this);
	}

	public boolean isStructural() {
		return STRUCTURAL.contains(this);
	}

	public static Set<String> allTokens() {
		return Collections.unmodifiableSet(BY_TOKEN.keySet());
	}

	public static BelRelation fromToken(String token) {
		BelRelation relation = BY_TOKEN.get(token);
		if(relation == null) {
			throw new IllegalArgumentException("not a BEL relation: " + token);
		}
		return relation;
	}

	@Override
	public String toString() {
		return canonicalName;
	}
}
