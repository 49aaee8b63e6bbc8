package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;
import ctc.model.cubicle.CubicleAndNestedOr;

public class NestedOrNotAllowedIssue extends Issue {

	private final CubicleAndNestedOr nestedOr;

	public NestedOrNotAllowedIssue(CubicleAndNestedOr nestedOr) {
		this.nestedOr = nestedOr;
	}

	public CubicleAndNestedOr getNestedOr() {
		return nestedOr;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
