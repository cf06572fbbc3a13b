package belc.model.graph;

import belc.errors.Issue;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * A diagnostic recorded against the graph: the offending line, the issue, and the annotations that were in effect
 * when it was raised.
 */
public final class BelWarning {

	private final int lineNumber;
	private final String line;
	private final Issue issue;
	private final SortedMap<String, Set<String>> annotations;

	public BelWarning(int lineNumber, String line, Issue issue, Map<String, ? extends Set<String>> annotations) {
		this.lineNumber = lineNumber;
		this.line = line;
		this.issue = issue;
		ImmutableSortedMap.Builder<String, Set<String>> builder = ImmutableSortedMap.naturalOrder();
		for(Map.Entry<String, ? extends Set<String>> entry : annotations.entrySet()) {
			builder.put(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue()));
		}
		this.annotations = builder.build();
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public String getLine() {
		return line;
	}

	public Issue getIssue() {
		return issue;
	}

	public SortedMap<String, Set<String>> getAnnotations() {
		return annotations;
	}

	@Override
	public String toString() {
		return lineNumber + ": " + issue;
	}
}
