package belc.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The BEL functions that denote graph nodes. Each has a short form used in canonical output and one or more long
 * forms accepted on input.
 */
public enum BelFunction {
	ABUNDANCE("a", "abundance"),
	GENE("g", "geneAbundance"),
	RNA("r", "rnaAbundance"),
	MIRNA("m", "microRNAAbundance"),
	PROTEIN("p", "proteinAbundance"),
	COMPLEX("complex", "complexAbundance"),
	COMPOSITE("composite", "compositeAbundance"),
	BIOLOGICAL_PROCESS("bp", "biologicalProcess"),
	PATHOLOGY("path", "pathology", "o"),
	REACTION("rxn", "reaction");

	private static final Map<String, BelFunction> BY_KEYWORD = new HashMap<>();
	static {
		for(BelFunction function : values()) {
			for(String keyword : function.keywords) {
				BY_KEYWORD.put(keyword, function);
			}
		}
	}

	private final String shortName;
	private final List<String> keywords;

	BelFunction(String shortName, String... longNames) {
		this.shortName = shortName;
		String[] all = new String[longNames.length + 1];
		all[0] = shortName;
		System.arraycopy(longNames, 0, all, 1, longNames.length);
		this.keywords = Collections.unmodifiableList(Arrays.asList(all));
	}

	public String getShortName() {
		return shortName;
	}

	/**
	 * @return every spelling of this function accepted in BEL source, short form first
	 */
	public List<String> getKeywords() {
		return keywords;
	}

	public static BelFunction fromKeyword(String keyword) {
		BelFunction function = BY_KEYWORD.get(keyword);
		if(function == null) {
			throw new IllegalArgumentException("not a BEL function: " + keyword);
		}
		return function;
	}

	/**
	 * @return the function one step up the central dogma (gene for RNA and miRNA, RNA for protein), or null
	 */
	public BelFunction getUpstream() {
		switch (this) {
			case RNA:
			case MIRNA:
				return GENE;
			case PROTEIN:
				return RNA;
			default:
				return null;
		}
	}

	/**
	 * @return the relation linking {@link #getUpstream()} to this function, or null
	 */
	public BelRelation getRelationFromUpstream() {
		switch (this) {
			case RNA:
			case MIRNA:
				return BelRelation.TRANSCRIBED_TO;
			case PROTEIN:
				return BelRelation.TRANSLATED_TO;
			default:
				return null;
		}
	}
}
