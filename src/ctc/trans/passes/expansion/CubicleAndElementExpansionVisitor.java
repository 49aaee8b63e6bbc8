package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens the elements of a conjunction that stands on its own, outside of any disjunction.
 */
public class CubicleAndElementExpansionVisitor
		extends CubicleAndElementVisitor<List<CubicleBoolExpression>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleAndElementExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public List<CubicleBoolExpression> visit(CubicleAndTerm andTerm) throws RuntimeException {
		CubicleBoolExpression expanded = andTerm.getExpression().accept(
				new CubicleBoolExpressionExpansionVisitor(generator, context));
		if (expanded == null) {
			return Collections.emptyList();
		}
		return Collections.singletonList(expanded);
	}

	@Override
	public List<CubicleBoolExpression> visit(CubicleAndNestedOr andNestedOr) throws RuntimeException {
		throw new NestedOrNotAllowedIssue(andNestedOr);
	}

	@Override
	public List<CubicleBoolExpression> visit(CubicleAndIterator andIterator) throws RuntimeException {
		List<CubicleBoolExpression> result = new ArrayList<>();
		for (TemplateContext instance : generator.instances(andIterator.getDeclaration(), context)) {
			result.addAll(generator.expandAnd(andIterator.getBody(), instance));
		}
		return result;
	}

}
