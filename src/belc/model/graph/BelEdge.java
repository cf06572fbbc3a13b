package belc.model.graph;

import belc.formatters.BelEdgeFormatter;
import belc.model.BelRelation;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A directed edge of the BEL graph. The key is a content hash over both endpoints, the relation and the
 * serialized context, so adding the same statement twice yields one edge. Whether the edge is the implied reverse
 * of a symmetric statement is not part of the key.
 */
public final class BelEdge {

	private final BelNode source;
	private final BelNode target;
	private final BelRelation relation;
	private final EdgeContext context;
	private final boolean reverse;
	private final String key;

	public BelEdge(BelNode source, BelRelation relation, BelNode target, EdgeContext context, boolean reverse) {
		this.source = Objects.requireNonNull(source);
		this.relation = Objects.requireNonNull(relation);
		this.target = Objects.requireNonNull(target);
		this.context = context;
		this.reverse = reverse;
		this.key = computeKey(source, relation, target, context);
	}

	public static BelEdge unqualified(BelNode source, BelRelation relation, BelNode target) {
		return new BelEdge(source, relation, target, null, false);
	}

	public static String computeKey(BelNode source, BelRelation relation, BelNode target, EdgeContext context) {
		String serialized = source.toBel() + "\t" + relation.getCanonicalName() + "\t" + target.toBel() + "\t" +
				(context == null ? "" : BelEdgeFormatter.serializeContext(context));
		return Hashing.sha256().hashString(serialized, StandardCharsets.UTF_8).toString();
	}

	public BelNode getSource() {
		return source;
	}

	public BelNode getTarget() {
		return target;
	}

	public BelRelation getRelation() {
		return relation;
	}

	/**
	 * @return the qualification of this edge, or null for unqualified edges
	 */
	public EdgeContext getContext() {
		return context;
	}

	public boolean isQualified() {
		return context != null;
	}

	/**
	 * @return whether this edge was implied by a symmetric statement written the other way round
	 */
	public boolean isReverse() {
		return reverse;
	}

	public String getKey() {
		return key;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return key.equals(((BelEdge) o).key);
	}

	@Override
	public int hashCode() {
		return key.hashCode();
	}

	@Override
	public String toString() {
		return source + " " + relation + " " + target;
	}
}
