package ctc.trans.passes.data;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

/**
 * The data file is not a JSON document whose root is an object.
 */
public class DataFormatIssue extends Issue {

	private final String problem;

	public DataFormatIssue(String problem) {
		this.problem = problem;
	}

	public String getProblem() {
		return problem;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
