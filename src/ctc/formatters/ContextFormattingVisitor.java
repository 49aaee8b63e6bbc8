package ctc.formatters;

import ctc.errors.ContextVisitor;
import ctc.model.cubicle.CubicleConstruct;
import ctc.model.cubicle.CubicleNode;
import ctc.model.cubicle.CubicleTransition;
import ctc.model.cubicle.CubicleTypeDeclaration;
import ctc.model.cubicle.CubicleVariableDeclaration;
import ctc.trans.passes.expansion.ExpandingConstruct;
import ctc.trans.passes.expansion.ExpandingName;
import ctc.trans.passes.expansion.ExpandingTemplateDeclaration;
import ctc.trans.passes.expansion.ExpandingTemplateReference;
import ctc.util.SourceLocation;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLine(SourceLocation location) throws IOException {
		if (!location.isUnknown()) {
			out.write("line ");
			out.write(Integer.toString(location.getLine()));
			out.write(": ");
		}
	}

	private void writeNode(CubicleNode node) throws IOException {
		node.accept(new CubicleNodeFormattingVisitor(out));
	}

	@Override
	public Void visit(ExpandingConstruct expandingConstruct) throws IOException {
		CubicleConstruct construct = expandingConstruct.getConstruct();
		writeLine(construct.getLocation());
		out.write("in ");
		if (construct.getDeclaration() != null) {
			writeNode(construct.getDeclaration());
			out.write(" ");
		}
		out.write(construct.getKeyword());
		if (construct instanceof CubicleTypeDeclaration) {
			out.write(" ");
			writeNode(((CubicleTypeDeclaration) construct).getName());
		} else if (construct instanceof CubicleVariableDeclaration) {
			out.write(" ");
			writeNode(((CubicleVariableDeclaration) construct).getVariable());
		} else if (construct instanceof CubicleTransition) {
			out.write(" ");
			writeNode(((CubicleTransition) construct).getName());
		}
		return null;
	}

	@Override
	public Void visit(ExpandingTemplateDeclaration expandingTemplateDeclaration) throws IOException {
		writeLine(expandingTemplateDeclaration.getDeclaration().getLocation());
		out.write("in template declaration ");
		writeNode(expandingTemplateDeclaration.getDeclaration());
		return null;
	}

	@Override
	public Void visit(ExpandingName expandingName) throws IOException {
		writeLine(expandingName.getName().getLocation());
		out.write("in name ");
		writeNode(expandingName.getName());
		return null;
	}

	@Override
	public Void visit(ExpandingTemplateReference expandingTemplateReference) throws IOException {
		writeLine(expandingTemplateReference.getReference().getLocation());
		out.write("in template reference @");
		writeNode(expandingTemplateReference.getReference());
		out.write("@");
		return null;
	}

}
