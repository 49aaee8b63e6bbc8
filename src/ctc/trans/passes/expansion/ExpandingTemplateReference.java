package ctc.trans.passes.expansion;

import ctc.errors.Context;
import ctc.errors.ContextVisitor;
import ctc.model.template.TemplateReference;

public class ExpandingTemplateReference extends Context {

	private final TemplateReference reference;

	public ExpandingTemplateReference(TemplateReference reference) {
		this.reference = reference;
	}

	public TemplateReference getReference() {
		return reference;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
