package belc.model.graph;

import belc.model.BelFunction;
import belc.model.BelRelation;
import belc.model.metadata.Definition;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelGraphTest {

	private static final SimpleNode AKT1 = new SimpleNode(BelFunction.PROTEIN, new Concept("HGNC", "AKT1"));
	private static final SimpleNode TP53 = new SimpleNode(BelFunction.PROTEIN, new Concept("HGNC", "TP53"));

	private static EdgeContext context(Map<String, Set<String>> annotations) {
		return new EdgeContext(new Citation("PubMed", "1"), "text", annotations,
				EndpointContext.empty(), EndpointContext.empty());
	}

	@Test
	public void testNodeIdentityIsCanonicalBel() {
		SimpleNode again = new SimpleNode(BelFunction.PROTEIN, new Concept("HGNC", "AKT1"));
		assertThat(again, is(AKT1));
		assertThat(again.getIdentity(), is(AKT1.getIdentity()));
		assertThat(AKT1.getIdentity(), not(TP53.getIdentity()));
	}

	@Test
	public void testEdgeKeys() {
		BelEdge first = new BelEdge(AKT1, BelRelation.INCREASES, TP53,
				context(Collections.singletonMap("Species", Collections.singleton("9606"))), false);
		BelEdge same = new BelEdge(AKT1, BelRelation.INCREASES, TP53,
				context(Collections.singletonMap("Species", Collections.singleton("9606"))), false);
		BelEdge otherAnnotations = new BelEdge(AKT1, BelRelation.INCREASES, TP53,
				context(Collections.singletonMap("Species", Collections.singleton("10090"))), false);
		BelEdge otherRelation = new BelEdge(AKT1, BelRelation.DECREASES, TP53,
				context(Collections.singletonMap("Species", Collections.singleton("9606"))), false);
		assertThat(first.getKey(), is(same.getKey()));
		assertThat(first.getKey(), not(otherAnnotations.getKey()));
		assertThat(first.getKey(), not(otherRelation.getKey()));
		assertThat(BelEdge.unqualified(AKT1, BelRelation.IS_A, TP53).getKey(),
				is(BelEdge.computeKey(AKT1, BelRelation.IS_A, TP53, null)));
	}

	@Test
	public void testValueSeparatorsCannotCollide() {
		BelEdge joined = new BelEdge(AKT1, BelRelation.INCREASES, TP53,
				context(Collections.singletonMap("A", Collections.singleton("x|y"))), false);
		BelEdge split = new BelEdge(AKT1, BelRelation.INCREASES, TP53,
				context(Collections.singletonMap("A", new HashSet<>(Arrays.asList("x", "y")))), false);
		assertThat(joined.getKey(), not(split.getKey()));

		EdgeContext oneAuthor = new EdgeContext(
				new Citation("Book", "isbn", null, null, Collections.singletonList("Smith|Doe"), null),
				"text", Collections.emptyMap(), EndpointContext.empty(), EndpointContext.empty());
		EdgeContext twoAuthors = new EdgeContext(
				new Citation("Book", "isbn", null, null, Arrays.asList("Smith", "Doe"), null),
				"text", Collections.emptyMap(), EndpointContext.empty(), EndpointContext.empty());
		assertThat(BelEdge.computeKey(AKT1, BelRelation.INCREASES, TP53, oneAuthor),
				not(BelEdge.computeKey(AKT1, BelRelation.INCREASES, TP53, twoAuthors)));
	}

	@Test
	public void testAnnotationOrderDoesNotChangeKey() {
		Map<String, Set<String>> forward = new LinkedHashMap<>();
		forward.put("Species", new HashSet<>(Arrays.asList("9606", "10090")));
		forward.put("CellLine", Collections.singleton("HeLa"));
		Map<String, Set<String>> backward = new LinkedHashMap<>();
		backward.put("CellLine", Collections.singleton("HeLa"));
		backward.put("Species", new HashSet<>(Arrays.asList("10090", "9606")));
		assertThat(new BelEdge(AKT1, BelRelation.INCREASES, TP53, context(forward), false).getKey(),
				is(new BelEdge(AKT1, BelRelation.INCREASES, TP53, context(backward), false).getKey()));
	}

	@Test
	public void testAddEdgeKeepsFirst() {
		BelGraph graph = new BelGraph();
		BelEdge edge = new BelEdge(AKT1, BelRelation.INCREASES, TP53, context(Collections.emptyMap()), false);
		assertThat(graph.addEdge(edge), sameInstance(edge));
		BelEdge duplicate = new BelEdge(AKT1, BelRelation.INCREASES, TP53, context(Collections.emptyMap()), false);
		assertThat(graph.addEdge(duplicate), sameInstance(edge));
		assertThat(graph.numberOfEdges(), is(1));
		assertThat(graph.numberOfNodes(), is(2));
		assertTrue(graph.containsEdge(edge.getKey()));
		assertThat(graph.outEdges(AKT1).size(), is(1));
		assertThat(graph.inEdges(AKT1).size(), is(0));
		assertThat(graph.edgesBetween(TP53, AKT1).size(), is(0));
	}

	@Test
	public void testMerge() {
		BelGraph left = new BelGraph();
		left.addNode(AKT1);
		left.getMetadata().defineNamespace(Definition.url("HGNC", "left"));
		BelGraph right = new BelGraph();
		right.addEdge(new BelEdge(AKT1, BelRelation.INCREASES, TP53, context(Collections.emptyMap()), false));
		right.addEdge(BelEdge.unqualified(TP53, BelRelation.IS_A, AKT1));
		right.getMetadata().defineNamespace(Definition.url("HGNC", "right"));
		right.getMetadata().defineNamespace(Definition.url("GO", "right"));

		left.merge(right);
		assertThat(left.numberOfNodes(), is(2));
		assertThat(left.numberOfEdges(), is(2));
		assertThat(left.getMetadata().getNamespaces().get("HGNC").getValue(), is("left"));
		assertTrue(left.getMetadata().getNamespaces().containsKey("GO"));

		left.merge(right);
		assertThat(left.numberOfEdges(), is(2));
	}
}
