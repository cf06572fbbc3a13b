package belc.model.graph;

/**
 * The translocation functions. Secretion and surface expression are shorthands for translocations between fixed
 * GO cellular components.
 */
public enum TranslocationKind {
	TRANSLOCATION("tloc", null, null),
	SECRETION("sec", new Concept("GO", "intracellular"), new Concept("GO", "extracellular space")),
	SURFACE_EXPRESSION("surf", new Concept("GO", "intracellular"), new Concept("GO", "cell surface"));

	private final String keyword;
	private final Concept defaultFrom;
	private final Concept defaultTo;

	TranslocationKind(String keyword, Concept defaultFrom, Concept defaultTo) {
		this.keyword = keyword;
		this.defaultFrom = defaultFrom;
		this.defaultTo = defaultTo;
	}

	public String getKeyword() {
		return keyword;
	}

	public Concept getDefaultFrom() {
		return defaultFrom;
	}

	public Concept getDefaultTo() {
		return defaultTo;
	}
}
