package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expands the elements of a conjunction that is a branch of a disjunction. Each element yields
 * its alternatives, each one a list of conjuncts; the branch is the product of the alternatives
 * of its elements, distributing the conjunction over nested disjunctions.
 */
public class CubicleAndElementDistributingVisitor
		extends CubicleAndElementVisitor<List<List<CubicleBoolExpression>>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleAndElementDistributingVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	private static List<List<CubicleBoolExpression>> product(List<List<CubicleBoolExpression>> left,
	                                                        List<List<CubicleBoolExpression>> right) {
		List<List<CubicleBoolExpression>> result = new ArrayList<>();
		for (List<CubicleBoolExpression> prefix : left) {
			for (List<CubicleBoolExpression> suffix : right) {
				List<CubicleBoolExpression> conjuncts = new ArrayList<>(prefix);
				conjuncts.addAll(suffix);
				result.add(conjuncts);
			}
		}
		return result;
	}

	/**
	 * Distributes a conjunction into the list of its alternative conjunct lists, keeping the
	 * source order of the conjuncts in each alternative. An element without alternatives, such as
	 * a nested disjunction that expanded to nothing, does not constrain the result.
	 */
	public static List<List<CubicleBoolExpression>> distribute(TemplateInstanceGenerator generator,
	                                                           CubicleAndExpression expression,
	                                                           TemplateContext context) {
		List<List<CubicleBoolExpression>> result = new ArrayList<>();
		result.add(Collections.emptyList());
		CubicleAndElementDistributingVisitor v = new CubicleAndElementDistributingVisitor(generator, context);
		for (CubicleAndElement element : expression.getElements()) {
			List<List<CubicleBoolExpression>> alternatives = element.accept(v);
			if (alternatives.isEmpty()) {
				continue;
			}
			result = product(result, alternatives);
		}
		return result;
	}

	@Override
	public List<List<CubicleBoolExpression>> visit(CubicleAndTerm andTerm) throws RuntimeException {
		CubicleBoolExpression expanded = andTerm.getExpression().accept(
				new CubicleBoolExpressionExpansionVisitor(generator, context));
		if (expanded == null) {
			return Collections.emptyList();
		}
		return Collections.singletonList(Collections.singletonList(expanded));
	}

	@Override
	public List<List<CubicleBoolExpression>> visit(CubicleAndNestedOr andNestedOr) throws RuntimeException {
		return generator.expandOrBranches(andNestedOr.getExpression(), context);
	}

	@Override
	public List<List<CubicleBoolExpression>> visit(CubicleAndIterator andIterator) throws RuntimeException {
		List<List<CubicleBoolExpression>> result = new ArrayList<>();
		result.add(Collections.emptyList());
		for (TemplateContext instance : generator.instances(andIterator.getDeclaration(), context)) {
			List<List<CubicleBoolExpression>> alternatives = distribute(generator, andIterator.getBody(), instance);
			result = product(result, alternatives);
		}
		return result;
	}

}
