package ctc.trans.passes.expansion;

import ctc.model.data.DataEnvironment;
import ctc.model.data.DataValue;
import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateContext;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;
import ctc.model.template.TemplateReferenceVisitor;

public class TemplateReferenceExpansionVisitor extends TemplateReferenceVisitor<DataValue, RuntimeException> {

	private final DataEnvironment data;
	private final TemplateContext context;

	public TemplateReferenceExpansionVisitor(DataEnvironment data, TemplateContext context) {
		this.data = data;
		this.context = context;
	}

	@Override
	public DataValue visit(TemplateArgument argument) throws RuntimeException {
		DataValue value = data.lookup(argument.getName());
		if (value == null) {
			throw new UnknownTemplateArgumentIssue(argument);
		}
		return value;
	}

	@Override
	public DataValue visit(TemplateKeyReference keyReference) throws RuntimeException {
		return context.getKey(keyReference.getIndex());
	}

	@Override
	public DataValue visit(TemplateFieldReference fieldReference) throws RuntimeException {
		return context.getField(fieldReference.getIndex(), fieldReference.getField());
	}

}
