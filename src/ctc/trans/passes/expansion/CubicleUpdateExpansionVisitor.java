package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CubicleUpdateExpansionVisitor extends CubicleUpdateVisitor<List<CubicleUpdate>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleUpdateExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public List<CubicleUpdate> visit(CubicleAssignment assignment) throws RuntimeException {
		CubicleReference lhs = new CubicleExpressionExpansionVisitor(generator, context)
				.expandReference(assignment.getLhs());
		CubicleAssignValue rhs = assignment.getRhs().accept(new CubicleAssignValueExpansionVisitor(generator, context));
		if (rhs == null) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new CubicleAssignment(assignment.getLocation(), lhs, rhs));
	}

	@Override
	public List<CubicleUpdate> visit(CubicleUpdateIterator updateIterator) throws RuntimeException {
		List<CubicleUpdate> result = new ArrayList<>();
		for (TemplateContext instance : generator.instances(updateIterator.getDeclaration(), context)) {
			CubicleUpdateExpansionVisitor v = new CubicleUpdateExpansionVisitor(generator, instance);
			for (CubicleUpdate update : updateIterator.getBody()) {
				result.addAll(update.accept(v));
			}
		}
		return result;
	}

}
