package ctc.model.template;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

public class UndefinedContextIndexIssue extends Issue {

	private final int index;
	private final int contextSize;

	public UndefinedContextIndexIssue(int index, int contextSize) {
		this.index = index;
		this.contextSize = contextSize;
	}

	public int getIndex() {
		return index;
	}

	public int getContextSize() {
		return contextSize;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
