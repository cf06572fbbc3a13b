package belc.model.graph;

import belc.errors.Issue;
import belc.model.metadata.DocumentMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A directed multigraph of BEL nodes. Nodes and edges are kept in insertion order; edges are keyed by content, so
 * re-adding an edge is a no-op.
 */
public class BelGraph {

	private final Set<BelNode> nodes = new LinkedHashSet<>();
	private final Map<String, BelEdge> edges = new LinkedHashMap<>();
	private final List<BelWarning> warnings = new ArrayList<>();
	private final DocumentMetadata metadata = new DocumentMetadata();

	/**
	 * @return true if the node was not yet present
	 */
	public boolean addNode(BelNode node) {
		return nodes.add(node);
	}

	public boolean containsNode(BelNode node) {
		return nodes.contains(node);
	}

	public Collection<BelNode> nodes() {
		return Collections.unmodifiableSet(nodes);
	}

	public int numberOfNodes() {
		return nodes.size();
	}

	/**
	 * Adds an edge and both its endpoints.
	 *
	 * @return the edge now stored under the key, which is the earlier one if the edge was already present
	 */
	public BelEdge addEdge(BelEdge edge) {
		nodes.add(edge.getSource());
		nodes.add(edge.getTarget());
		BelEdge existing = edges.putIfAbsent(edge.getKey(), edge);
		return existing == null ? edge : existing;
	}

	public boolean containsEdge(String key) {
		return edges.containsKey(key);
	}

	public BelEdge getEdge(String key) {
		return edges.get(key);
	}

	public Collection<BelEdge> edges() {
		return Collections.unmodifiableCollection(edges.values());
	}

	public int numberOfEdges() {
		return edges.size();
	}

	public List<BelEdge> outEdges(BelNode node) {
		return edges.values().stream().filter(e -> e.getSource().equals(node)).collect(Collectors.toList());
	}

	public List<BelEdge> inEdges(BelNode node) {
		return edges.values().stream().filter(e -> e.getTarget().equals(node)).collect(Collectors.toList());
	}

	public List<BelEdge> edgesBetween(BelNode source, BelNode target) {
		return edges.values().stream()
				.filter(e -> e.getSource().equals(source) && e.getTarget().equals(target))
				.collect(Collectors.toList());
	}

	public void addWarning(int lineNumber, String line, Issue issue, Map<String, ? extends Set<String>> annotations) {
		warnings.add(new BelWarning(lineNumber, line, issue, annotations));
	}

	public List<BelWarning> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	public DocumentMetadata getMetadata() {
		return metadata;
	}

	/**
	 * Adds every node, edge and warning of {@code other} to this graph. Metadata of this graph wins where both
	 * define the same key.
	 */
	public void merge(BelGraph other) {
		nodes.addAll(other.nodes);
		for(BelEdge edge : other.edges.values()) {
			addEdge(edge);
		}
		warnings.addAll(other.warnings);
		metadata.mergeFrom(other.metadata);
	}
}
