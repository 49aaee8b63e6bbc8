package ctc.errors;

import ctc.trans.passes.expansion.ExpandingConstruct;
import ctc.trans.passes.expansion.ExpandingName;
import ctc.trans.passes.expansion.ExpandingTemplateDeclaration;
import ctc.trans.passes.expansion.ExpandingTemplateReference;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(ExpandingConstruct expandingConstruct) throws E;
	public abstract T visit(ExpandingTemplateDeclaration expandingTemplateDeclaration) throws E;
	public abstract T visit(ExpandingName expandingName) throws E;
	public abstract T visit(ExpandingTemplateReference expandingTemplateReference) throws E;

}
