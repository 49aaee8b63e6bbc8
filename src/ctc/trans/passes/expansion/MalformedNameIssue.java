package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

public class MalformedNameIssue extends Issue {

	private final String name;

	public MalformedNameIssue(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
