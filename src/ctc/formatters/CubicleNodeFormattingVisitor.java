package ctc.formatters;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;
import ctc.model.template.TemplateReference;

import java.io.IOException;
import java.util.List;

/**
 * Prints any Cubicle node in template syntax, so that the output of a parsed template can be
 * parsed again. Models are printed one construct per line.
 */
public class CubicleNodeFormattingVisitor extends CubicleNodeVisitor<Void, IOException> {

	protected final IndentingWriter out;

	public CubicleNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	protected void writeJoined(List<? extends CubicleNode> nodes, String separator) throws IOException {
		boolean first = true;
		for (CubicleNode node : nodes) {
			if (!first) {
				out.write(separator);
			}
			first = false;
			node.accept(this);
		}
	}

	protected void writeDeclaration(CubicleConstruct construct) throws IOException {
		if (construct.getDeclaration() != null) {
			construct.getDeclaration().accept(this);
			out.write(" ");
		}
	}

	private void writeBlock(List<? extends CubicleNode> body) throws IOException {
		out.write(" (");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CubicleNode node : body) {
				out.newLine();
				node.accept(this);
			}
		}
		out.newLine();
		out.write(")");
	}

	@Override
	public Void visit(CubicleModel model) throws IOException {
		if (model.getProcessCount() != null) {
			out.write("number_procs ");
			out.write(model.getProcessCount());
			out.newLine();
		}
		for (CubicleTypeDeclaration type : model.getTypes()) {
			type.accept(this);
			out.newLine();
		}
		for (CubicleVariableDeclaration declaration : model.getDeclarations()) {
			declaration.accept(this);
			out.newLine();
		}
		model.getInit().accept(this);
		out.newLine();
		for (CubicleProcExprConstruct invariant : model.getInvariants()) {
			invariant.accept(this);
			out.newLine();
		}
		for (CubicleProcExprConstruct unsafe : model.getUnsafes()) {
			unsafe.accept(this);
			out.newLine();
		}
		for (CubicleTransition transition : model.getTransitions()) {
			transition.accept(this);
			out.newLine();
		}
		return null;
	}

	@Override
	public Void visit(CubicleTypeDeclaration typeDeclaration) throws IOException {
		writeDeclaration(typeDeclaration);
		out.write("type ");
		typeDeclaration.getName().accept(this);
		// an enumeration whose constructors all vanished is an abstract type
		if (typeDeclaration.isEnumerated() && !typeDeclaration.getConstructors().isEmpty()) {
			out.write(" = ");
			writeJoined(typeDeclaration.getConstructors(), " | ");
		}
		return null;
	}

	@Override
	public Void visit(CubicleVariableDeclaration variableDeclaration) throws IOException {
		writeDeclaration(variableDeclaration);
		out.write(variableDeclaration.getKeyword());
		out.write(" ");
		variableDeclaration.getVariable().accept(this);
		out.write(" : ");
		variableDeclaration.getType().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleProcExprConstruct procExprConstruct) throws IOException {
		writeDeclaration(procExprConstruct);
		out.write(procExprConstruct.getKeyword());
		out.write(" (");
		out.write(String.join(" ", procExprConstruct.getProcesses()));
		out.write(") { ");
		procExprConstruct.getFormula().accept(this);
		out.write(" }");
		return null;
	}

	@Override
	public Void visit(CubicleTransition transition) throws IOException {
		writeDeclaration(transition);
		out.write("transition ");
		transition.getName().accept(this);
		out.write(" (");
		out.write(String.join(" ", transition.getProcesses()));
		out.write(")");
		if (transition.getGuard() != null) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				out.write("requires { ");
				transition.getGuard().accept(this);
				out.write(" }");
			}
		}
		out.newLine();
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CubicleUpdate update : transition.getUpdates()) {
				out.newLine();
				update.accept(this);
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(CubicleEnumName enumName) throws IOException {
		enumName.getName().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleEnumIterator enumIterator) throws IOException {
		enumIterator.getDeclaration().accept(this);
		out.write(" (");
		writeJoined(enumIterator.getBody(), " | ");
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CubicleAssignment assignment) throws IOException {
		assignment.getLhs().accept(this);
		out.write(" := ");
		assignment.getRhs().accept(this);
		if (assignment.getRhs() instanceof CubicleSwitch) {
			out.newLine();
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CubicleUpdateIterator updateIterator) throws IOException {
		updateIterator.getDeclaration().accept(this);
		writeBlock(updateIterator.getBody());
		return null;
	}

	@Override
	public Void visit(CubicleExpressionValue expressionValue) throws IOException {
		expressionValue.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleSwitch cubicleSwitch) throws IOException {
		out.write("case");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CubicleCaseElement element : cubicleSwitch.getCases()) {
				out.newLine();
				element.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(CubicleNondeterministic nondeterministic) throws IOException {
		out.write("?");
		return null;
	}

	@Override
	public Void visit(CubicleCase cubicleCase) throws IOException {
		out.write("| ");
		if (cubicleCase.isWildcard()) {
			out.write("_");
		} else {
			cubicleCase.getGuard().accept(this);
		}
		out.write(" : ");
		cubicleCase.getValue().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleCaseIterator caseIterator) throws IOException {
		caseIterator.getDeclaration().accept(this);
		writeBlock(caseIterator.getBody());
		return null;
	}

	@Override
	public Void visit(CubicleOrExpression orExpression) throws IOException {
		writeJoined(orExpression.getElements(), " || ");
		return null;
	}

	@Override
	public Void visit(CubicleOrBranch orBranch) throws IOException {
		orBranch.getBranch().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleOrIterator orIterator) throws IOException {
		orIterator.getDeclaration().accept(this);
		out.write(" (|| ");
		orIterator.getBody().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CubicleAndExpression andExpression) throws IOException {
		writeJoined(andExpression.getElements(), " && ");
		return null;
	}

	@Override
	public Void visit(CubicleAndTerm andTerm) throws IOException {
		andTerm.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleAndNestedOr andNestedOr) throws IOException {
		out.write("(");
		andNestedOr.getExpression().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CubicleAndIterator andIterator) throws IOException {
		andIterator.getDeclaration().accept(this);
		out.write(" (&& ");
		andIterator.getBody().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CubicleComparison comparison) throws IOException {
		comparison.getLhs().accept(this);
		out.write(" ");
		out.write(comparison.getOperator());
		out.write(" ");
		comparison.getRhs().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleForallOther forallOther) throws IOException {
		out.write("forall_other ");
		out.write(forallOther.getProcess());
		out.write(". ");
		if (forallOther.hasFormula()) {
			out.write("(");
			forallOther.getFormula().accept(this);
			out.write(")");
		} else {
			forallOther.getComparison().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(CubicleReference reference) throws IOException {
		reference.getName().accept(this);
		if (reference.isArray()) {
			out.write("[");
			writeJoined(reference.getIndices(), ", ");
			out.write("]");
		}
		return null;
	}

	@Override
	public Void visit(CubicleConstant constant) throws IOException {
		out.write(constant.getValue());
		return null;
	}

	@Override
	public Void visit(CubicleBinop binop) throws IOException {
		binop.getLhs().accept(this);
		out.write(" ");
		out.write(binop.getOperator());
		out.write(" ");
		binop.getRhs().accept(this);
		return null;
	}

	@Override
	public Void visit(CubicleName name) throws IOException {
		List<String> fragments = name.getFragments();
		List<TemplateReference> references = name.getReferences();
		out.write(fragments.get(0));
		for (int i = 0; i < references.size(); ++i) {
			out.write("@");
			references.get(i).accept(this);
			out.write("@");
			out.write(fragments.get(i + 1));
		}
		return null;
	}

	@Override
	public Void visit(TemplateDeclaration templateDeclaration) throws IOException {
		out.write("@");
		writeJoined(templateDeclaration.getArguments(), ", ");
		if (templateDeclaration.getCondition() != null) {
			out.write(" | ");
			templateDeclaration.getCondition().accept(this);
		}
		out.write("@");
		return null;
	}

	@Override
	public Void visit(TemplateArgument templateArgument) throws IOException {
		out.write(templateArgument.getName());
		return null;
	}

	@Override
	public Void visit(TemplateKeyReference templateKeyReference) throws IOException {
		out.write(Integer.toString(templateKeyReference.getIndex()));
		return null;
	}

	@Override
	public Void visit(TemplateFieldReference templateFieldReference) throws IOException {
		out.write(Integer.toString(templateFieldReference.getIndex()));
		out.write(".");
		out.write(templateFieldReference.getField());
		return null;
	}

}
