package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;
import ctc.model.data.DataValue;

public class NotIterableIssue extends Issue {

	private final DataValue value;

	public NotIterableIssue(DataValue value) {
		this.value = value;
	}

	public DataValue getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
