package ctc.trans.passes.expansion;

import ctc.errors.Context;
import ctc.errors.ContextVisitor;
import ctc.model.template.TemplateDeclaration;

public class ExpandingTemplateDeclaration extends Context {

	private final TemplateDeclaration declaration;

	public ExpandingTemplateDeclaration(TemplateDeclaration declaration) {
		this.declaration = declaration;
	}

	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
