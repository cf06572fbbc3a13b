package belc.model.graph;

import belc.formatters.BelNodeFormattingVisitor;
import belc.model.BelFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A node of the BEL graph. Nodes are immutable and their identity is a pure function of their content: each
 * concrete node renders itself to canonical BEL once, at the end of its constructor, and equality, ordering and
 * the content hash are all derived from that rendering.
 */
public abstract class BelNode implements Comparable<BelNode> {

	private final BelFunction function;
	private String canonicalBel;
	private String identity;

	protected BelNode(BelFunction function) {
		this.function = function;
	}

	/**
	 * Must be the last statement of every concrete constructor.
	 */
	protected final void computeIdentity() {
		canonicalBel = BelNodeFormattingVisitor.format(this);
		identity = Hashing.sha256().hashString(canonicalBel, StandardCharsets.UTF_8).toString();
	}

	public BelFunction getFunction() {
		return function;
	}

	/**
	 * @return the canonical BEL rendering of this node
	 */
	public String toBel() {
		return canonicalBel;
	}

	/**
	 * @return the hex SHA-256 hash of {@link #toBel()}
	 */
	public String getIdentity() {
		return identity;
	}

	public abstract <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E;

	@Override
	public int compareTo(BelNode o) {
		return canonicalBel.compareTo(o.canonicalBel);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BelNode)) return false;
		return canonicalBel.equals(((BelNode) o).canonicalBel);
	}

	@Override
	public int hashCode() {
		return canonicalBel.hashCode();
	}

	@Override
	public String toString() {
		return canonicalBel;
	}
}
