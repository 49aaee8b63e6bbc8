package ctc.model.template;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

public class UnknownContextFieldIssue extends Issue {

	private final int index;
	private final String field;
	private final TemplateBinding binding;

	public UnknownContextFieldIssue(int index, String field, TemplateBinding binding) {
		this.index = index;
		this.field = field;
		this.binding = binding;
	}

	public int getIndex() {
		return index;
	}

	public String getField() {
		return field;
	}

	public TemplateBinding getBinding() {
		return binding;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
