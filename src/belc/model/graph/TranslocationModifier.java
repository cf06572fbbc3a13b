package belc.model.graph;

import java.util.Objects;

/**
 * A translocation between two cellular locations. The {@code sec} and {@code surf} shorthands keep their kind so
 * they can be written back in short form; their locations are the kind's defaults.
 */
public final class TranslocationModifier extends Modifier {

	private final TranslocationKind kind;
	private final Concept from;
	private final Concept to;

	public TranslocationModifier(TranslocationKind kind, Concept from, Concept to) {
		this.kind = kind;
		this.from = Objects.requireNonNull(from);
		this.to = Objects.requireNonNull(to);
	}

	public static TranslocationModifier shorthand(TranslocationKind kind) {
		if(kind == TranslocationKind.TRANSLOCATION) {
			throw new IllegalArgumentException("tloc has no default locations");
		}
		return new TranslocationModifier(kind, kind.getDefaultFrom(), kind.getDefaultTo());
	}

	public TranslocationKind getKind() {
		return kind;
	}

	public Concept getFrom() {
		return from;
	}

	public Concept getTo() {
		return to;
	}

	@Override
	public <T, E extends Throwable> T accept(ModifierVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TranslocationModifier that = (TranslocationModifier) o;
		return kind == that.kind && from.equals(that.from) && to.equals(that.to);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, from, to);
	}
}
