package belc.errors;

import belc.formatters.IndentingWriter;
import belc.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues;

	public TopLevelIssueContext() {
		this.issues = new ArrayList<>();
	}

	@Override
	public void report(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasErrors() {
		return issues.stream().anyMatch(Issue::isError);
	}

	public List<Issue> getIssues() {
		return issues;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(issues.size()));
		out.write(" issue(s):");
		for(Issue issue : issues) {
			out.newLine();
			out.write(issue.getSeverity().toString());
			out.write(": ");
			issue.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
