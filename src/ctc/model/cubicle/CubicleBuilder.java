package ctc.model.cubicle;

import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;
import ctc.model.template.TemplateReference;
import ctc.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class CubicleBuilder {
	private CubicleBuilder() {}

	/**
	 * Builds a name from literal strings and template references, in order. Adjacent references
	 * are separated by empty fragments.
	 */
	public static CubicleName name(Object... parts) {
		List<String> fragments = new ArrayList<>();
		List<TemplateReference> references = new ArrayList<>();
		StringBuilder fragment = new StringBuilder();
		for (Object part : parts) {
			if (part instanceof TemplateReference) {
				fragments.add(fragment.toString());
				fragment = new StringBuilder();
				references.add((TemplateReference) part);
			} else if (part instanceof String) {
				fragment.append((String) part);
			} else {
				throw new IllegalArgumentException("name parts are strings or template references, got " + part);
			}
		}
		fragments.add(fragment.toString());
		return new CubicleName(SourceLocation.unknown(), fragments, references);
	}

	public static TemplateArgument arg(String name) {
		return new TemplateArgument(SourceLocation.unknown(), name);
	}

	public static TemplateKeyReference key(int index) {
		return new TemplateKeyReference(SourceLocation.unknown(), index);
	}

	public static TemplateFieldReference field(int index, String field) {
		return new TemplateFieldReference(SourceLocation.unknown(), index, field);
	}

	public static TemplateDeclaration tdecl(TemplateReference... arguments) {
		return new TemplateDeclaration(SourceLocation.unknown(), Arrays.asList(arguments), null);
	}

	public static TemplateDeclaration tdeclIf(CubicleOrExpression condition, TemplateReference... arguments) {
		return new TemplateDeclaration(SourceLocation.unknown(), Arrays.asList(arguments), condition);
	}

	public static CubicleReference ref(CubicleName name, CubicleName... indices) {
		return new CubicleReference(SourceLocation.unknown(), name, Arrays.asList(indices));
	}

	public static CubicleReference ref(String name, String... indices) {
		List<CubicleName> indexNames = new ArrayList<>();
		for (String index : indices) {
			indexNames.add(name(index));
		}
		return new CubicleReference(SourceLocation.unknown(), name(name), indexNames);
	}

	public static CubicleConstant constant(String value) {
		return new CubicleConstant(SourceLocation.unknown(), value);
	}

	public static CubicleBinop binop(CubicleExpression lhs, String operator, CubicleExpression rhs) {
		return new CubicleBinop(SourceLocation.unknown(), lhs, operator, rhs);
	}

	public static CubicleComparison cmp(CubicleExpression lhs, String operator, CubicleExpression rhs) {
		return new CubicleComparison(SourceLocation.unknown(), lhs, operator, rhs);
	}

	public static CubicleComparison eq(CubicleExpression lhs, CubicleExpression rhs) {
		return cmp(lhs, "=", rhs);
	}

	public static CubicleComparison neq(CubicleExpression lhs, CubicleExpression rhs) {
		return cmp(lhs, "<>", rhs);
	}

	public static CubicleForallOther forall(String process, CubicleComparison comparison) {
		return new CubicleForallOther(SourceLocation.unknown(), process, comparison);
	}

	public static CubicleForallOther forall(String process, CubicleOrExpression formula) {
		return new CubicleForallOther(SourceLocation.unknown(), process, formula);
	}

	public static CubicleOrExpression or(CubicleOrElement... elements) {
		return new CubicleOrExpression(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static CubicleOrBranch branch(CubicleAndElement... elements) {
		return new CubicleOrBranch(SourceLocation.unknown(), and(elements));
	}

	public static CubicleOrIterator orIter(TemplateDeclaration declaration, CubicleAndElement... body) {
		return new CubicleOrIterator(SourceLocation.unknown(), declaration, and(body));
	}

	public static CubicleAndExpression and(CubicleAndElement... elements) {
		return new CubicleAndExpression(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static CubicleAndTerm term(CubicleBoolExpression expression) {
		return new CubicleAndTerm(SourceLocation.unknown(), expression);
	}

	public static CubicleAndNestedOr nestedOr(CubicleOrElement... elements) {
		return new CubicleAndNestedOr(SourceLocation.unknown(), or(elements));
	}

	public static CubicleAndIterator andIter(TemplateDeclaration declaration, CubicleAndElement... body) {
		return new CubicleAndIterator(SourceLocation.unknown(), declaration, and(body));
	}

	/**
	 * Builds an expanded formula: one disjunct per list of conjuncts.
	 */
	@SafeVarargs
	public static CubicleOrExpression dnf(List<CubicleBoolExpression>... branches) {
		List<CubicleOrElement> elements = new ArrayList<>();
		for (List<CubicleBoolExpression> conjuncts : branches) {
			List<CubicleAndElement> terms = new ArrayList<>();
			for (CubicleBoolExpression conjunct : conjuncts) {
				terms.add(term(conjunct));
			}
			elements.add(new CubicleOrBranch(SourceLocation.unknown(),
					new CubicleAndExpression(SourceLocation.unknown(), terms)));
		}
		return new CubicleOrExpression(SourceLocation.unknown(), elements);
	}

	public static CubicleAssignment assign(CubicleReference lhs, CubicleExpression value) {
		return new CubicleAssignment(SourceLocation.unknown(), lhs,
				new CubicleExpressionValue(SourceLocation.unknown(), value));
	}

	public static CubicleAssignment assignAny(CubicleReference lhs) {
		return new CubicleAssignment(SourceLocation.unknown(), lhs, new CubicleNondeterministic(SourceLocation.unknown()));
	}

	public static CubicleAssignment assignCase(CubicleReference lhs, CubicleCaseElement... cases) {
		return new CubicleAssignment(SourceLocation.unknown(), lhs,
				new CubicleSwitch(SourceLocation.unknown(), Arrays.asList(cases)));
	}

	public static CubicleCase caseOf(CubicleAndExpression guard, CubicleExpression value) {
		return new CubicleCase(SourceLocation.unknown(), guard, value);
	}

	public static CubicleCase wildcard(CubicleExpression value) {
		return new CubicleCase(SourceLocation.unknown(), null, value);
	}

	public static CubicleCaseIterator caseIter(TemplateDeclaration declaration, CubicleCaseElement... body) {
		return new CubicleCaseIterator(SourceLocation.unknown(), declaration, Arrays.asList(body));
	}

	public static CubicleUpdateIterator updateIter(TemplateDeclaration declaration, CubicleUpdate... body) {
		return new CubicleUpdateIterator(SourceLocation.unknown(), declaration, Arrays.asList(body));
	}

	public static CubicleEnumName enumName(CubicleName name) {
		return new CubicleEnumName(SourceLocation.unknown(), name);
	}

	public static CubicleEnumIterator enumIter(TemplateDeclaration declaration, CubicleEnumElement... body) {
		return new CubicleEnumIterator(SourceLocation.unknown(), declaration, Arrays.asList(body));
	}

	public static CubicleTypeDeclaration abstractType(TemplateDeclaration declaration, CubicleName name) {
		return new CubicleTypeDeclaration(SourceLocation.unknown(), declaration, name, null);
	}

	public static CubicleTypeDeclaration enumType(TemplateDeclaration declaration, CubicleName name,
	                                              CubicleEnumElement... constructors) {
		return new CubicleTypeDeclaration(SourceLocation.unknown(), declaration, name, Arrays.asList(constructors));
	}

	public static CubicleVariableDeclaration varDecl(TemplateDeclaration declaration,
	                                                 CubicleVariableDeclaration.Kind kind,
	                                                 CubicleReference variable, String type) {
		return new CubicleVariableDeclaration(SourceLocation.unknown(), declaration, kind, variable, name(type));
	}

	public static CubicleProcExprConstruct init(List<String> processes, CubicleOrExpression formula) {
		return new CubicleProcExprConstruct(SourceLocation.unknown(), null, CubicleProcExprConstruct.Kind.INIT,
				processes, formula);
	}

	public static CubicleProcExprConstruct invariant(TemplateDeclaration declaration, List<String> processes,
	                                                 CubicleOrExpression formula) {
		return new CubicleProcExprConstruct(SourceLocation.unknown(), declaration,
				CubicleProcExprConstruct.Kind.INVARIANT, processes, formula);
	}

	public static CubicleProcExprConstruct unsafe(TemplateDeclaration declaration, List<String> processes,
	                                              CubicleOrExpression formula) {
		return new CubicleProcExprConstruct(SourceLocation.unknown(), declaration,
				CubicleProcExprConstruct.Kind.UNSAFE, processes, formula);
	}

	public static CubicleTransition transition(TemplateDeclaration declaration, CubicleName name,
	                                           List<String> processes, CubicleOrExpression guard,
	                                           CubicleUpdate... updates) {
		return new CubicleTransition(SourceLocation.unknown(), declaration, name, processes, guard,
				Arrays.asList(updates));
	}

	public static List<String> procs(String... processes) {
		return Arrays.asList(processes);
	}

	public static CubicleModel model(String processCount, List<CubicleTypeDeclaration> types,
	                                 List<CubicleVariableDeclaration> declarations, CubicleProcExprConstruct init,
	                                 List<CubicleProcExprConstruct> invariants,
	                                 List<CubicleProcExprConstruct> unsafes, List<CubicleTransition> transitions) {
		return new CubicleModel(SourceLocation.unknown(), processCount, types, declarations, init, invariants,
				unsafes, transitions);
	}

	public static CubicleModel model(List<CubicleVariableDeclaration> declarations, CubicleProcExprConstruct init,
	                                 List<CubicleProcExprConstruct> unsafes, List<CubicleTransition> transitions) {
		return model(null, Collections.emptyList(), declarations, init, Collections.emptyList(), unsafes,
				transitions);
	}
}
