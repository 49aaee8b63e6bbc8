package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.model.cubicle.CubicleAndExpression;
import ctc.model.cubicle.CubicleAndElement;
import ctc.model.cubicle.CubicleAndTerm;
import ctc.model.cubicle.CubicleBoolExpression;
import ctc.model.cubicle.CubicleName;
import ctc.model.cubicle.CubicleNode;
import ctc.model.cubicle.CubicleOrBranch;
import ctc.model.cubicle.CubicleOrElement;
import ctc.model.cubicle.CubicleOrExpression;
import ctc.model.data.DataEnvironment;
import ctc.model.data.DataScalar;
import ctc.model.data.DataValue;
import ctc.model.template.TemplateBinding;
import ctc.model.template.TemplateContext;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves template references against the data and the current context, and enumerates the
 * instances requested by template declarations.
 */
public class TemplateInstanceGenerator {

	private static final Pattern NAME_FORMAT = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

	private final DataEnvironment data;

	public TemplateInstanceGenerator(DataEnvironment data) {
		this.data = data;
	}

	public DataEnvironment getData() {
		return data;
	}

	public DataValue expandReference(TemplateReference reference, TemplateContext context) {
		try {
			return reference.accept(new TemplateReferenceExpansionVisitor(data, context));
		} catch (Issue e) {
			throw e.withContext(new ExpandingTemplateReference(reference));
		}
	}

	/**
	 * Substitutes every reference of the name with its scalar value.
	 *
	 * @return a literal name matching [A-Za-z][A-Za-z0-9_]*
	 */
	public CubicleName expandName(CubicleName name, TemplateContext context) {
		try {
			StringBuilder text = new StringBuilder(name.getFragments().get(0));
			for (int i = 0; i < name.getReferences().size(); ++i) {
				TemplateReference reference = name.getReferences().get(i);
				DataValue value = expandReference(reference, context);
				if (!(value instanceof DataScalar)) {
					throw new NotScalarIssue(value).withContext(new ExpandingTemplateReference(reference));
				}
				text.append(((DataScalar) value).getText());
				text.append(name.getFragments().get(i + 1));
			}
			if (!NAME_FORMAT.matcher(text).matches()) {
				throw new MalformedNameIssue(text.toString());
			}
			return new CubicleName(name.getLocation(), text.toString());
		} catch (Issue e) {
			throw e.withContext(new ExpandingName(name));
		}
	}

	private List<TemplateBinding> bindings(TemplateReference reference, TemplateContext context) {
		DataValue collection = expandReference(reference, context);
		try {
			return collection.accept(new TemplateBindingVisitor());
		} catch (Issue e) {
			throw e.withContext(new ExpandingTemplateReference(reference));
		}
	}

	private void combine(TemplateDeclaration declaration, int index, TemplateContext context,
	                     List<TemplateContext> result) {
		List<TemplateReference> arguments = declaration.getArguments();
		if (index == arguments.size()) {
			if (declaration.getCondition() == null || isSatisfied(declaration.getCondition(), context)) {
				result.add(context);
			}
			return;
		}
		for (TemplateBinding binding : bindings(arguments.get(index), context)) {
			combine(declaration, index + 1, context.extend(binding), result);
		}
	}

	private boolean isSatisfied(CubicleOrExpression condition, TemplateContext context) {
		CubicleOrExpression expanded = expandOr(condition, context);
		return new ExpandedConditionEvaluator().evaluate(expanded);
	}

	/**
	 * Enumerates the instances of a declaration in the given context. Each argument of the
	 * declaration adds one binding, and may refer to the bindings added by the arguments before it.
	 * Instances come in lexicographic order of their new keys, filtered by the condition.
	 *
	 * @param declaration the declaration, or null
	 * @return the instance contexts; [context] when declaration is null
	 */
	public List<TemplateContext> instances(TemplateDeclaration declaration, TemplateContext context) {
		if (declaration == null) {
			return Collections.singletonList(context);
		}
		try {
			List<TemplateContext> result = new ArrayList<>();
			combine(declaration, 0, context, result);
			return result;
		} catch (Issue e) {
			throw e.withContext(new ExpandingTemplateDeclaration(declaration));
		}
	}

	/**
	 * Expands a formula into disjunctive normal form, as the list of the conjuncts of each branch.
	 * Branches without any conjunct are dropped.
	 */
	public List<List<CubicleBoolExpression>> expandOrBranches(CubicleOrExpression expression,
	                                                          TemplateContext context) {
		List<List<CubicleBoolExpression>> branches = new ArrayList<>();
		CubicleOrElementExpansionVisitor v = new CubicleOrElementExpansionVisitor(this, context);
		for (CubicleOrElement element : expression.getElements()) {
			for (List<CubicleBoolExpression> conjuncts : element.accept(v)) {
				if (!conjuncts.isEmpty()) {
					branches.add(conjuncts);
				}
			}
		}
		return branches;
	}

	/**
	 * Expands a formula into disjunctive normal form. The result has no element at all when every
	 * branch vanished.
	 */
	public CubicleOrExpression expandOr(CubicleOrExpression expression, TemplateContext context) {
		List<CubicleOrElement> elements = new ArrayList<>();
		for (List<CubicleBoolExpression> conjuncts : expandOrBranches(expression, context)) {
			elements.add(new CubicleOrBranch(expression.getLocation(), conjunction(expression, conjuncts)));
		}
		return new CubicleOrExpression(expression.getLocation(), elements);
	}

	/**
	 * Expands a conjunction that is not part of a disjunction, such as a case guard. Nested
	 * disjunctions are not allowed there.
	 */
	public List<CubicleBoolExpression> expandAnd(CubicleAndExpression expression, TemplateContext context) {
		List<CubicleBoolExpression> conjuncts = new ArrayList<>();
		CubicleAndElementExpansionVisitor v = new CubicleAndElementExpansionVisitor(this, context);
		for (CubicleAndElement element : expression.getElements()) {
			conjuncts.addAll(element.accept(v));
		}
		return conjuncts;
	}

	public static CubicleAndExpression conjunction(CubicleNode origin, List<CubicleBoolExpression> conjuncts) {
		List<CubicleAndElement> terms = new ArrayList<>();
		for (CubicleBoolExpression conjunct : conjuncts) {
			terms.add(new CubicleAndTerm(conjunct.getLocation(), conjunct));
		}
		return new CubicleAndExpression(origin.getLocation(), terms);
	}

}
