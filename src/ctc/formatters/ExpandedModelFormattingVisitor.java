package ctc.formatters;

import ctc.InternalCompilerError;
import ctc.model.cubicle.*;
import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;

import java.io.IOException;
import java.io.Writer;

/**
 * Prints a fully expanded model as a Cubicle program. Any template shape still present in the
 * tree means the expansion went wrong and is reported as an internal compiler error.
 *
 * The writer should indent with tabs, see {@link #forCubicle(Writer)}.
 */
public class ExpandedModelFormattingVisitor extends CubicleNodeFormattingVisitor {

	public ExpandedModelFormattingVisitor(IndentingWriter out) {
		super(out);
	}

	public static ExpandedModelFormattingVisitor forCubicle(Writer w) {
		return new ExpandedModelFormattingVisitor(new IndentingWriter(w, "\t"));
	}

	@Override
	protected void writeDeclaration(CubicleConstruct construct) throws IOException {
		if (construct.getDeclaration() != null) {
			throw new InternalCompilerError(
					"template declaration left on " + construct.getKeyword() + " in expanded model");
		}
	}

	@Override
	public Void visit(CubicleEnumIterator enumIterator) throws IOException {
		throw new InternalCompilerError("enum iterator left in expanded model");
	}

	@Override
	public Void visit(CubicleUpdateIterator updateIterator) throws IOException {
		throw new InternalCompilerError("update iterator left in expanded model");
	}

	@Override
	public Void visit(CubicleCaseIterator caseIterator) throws IOException {
		throw new InternalCompilerError("case iterator left in expanded model");
	}

	@Override
	public Void visit(CubicleOrIterator orIterator) throws IOException {
		throw new InternalCompilerError("|| iterator left in expanded model");
	}

	@Override
	public Void visit(CubicleAndIterator andIterator) throws IOException {
		throw new InternalCompilerError("&& iterator left in expanded model");
	}

	@Override
	public Void visit(CubicleAndNestedOr andNestedOr) throws IOException {
		throw new InternalCompilerError("nested || left in expanded model");
	}

	@Override
	public Void visit(CubicleName name) throws IOException {
		if (!name.isExpanded()) {
			throw new InternalCompilerError("template name left in expanded model");
		}
		out.write(name.getText());
		return null;
	}

	@Override
	public Void visit(TemplateDeclaration templateDeclaration) throws IOException {
		throw new InternalCompilerError("template declaration left in expanded model");
	}

	@Override
	public Void visit(TemplateArgument templateArgument) throws IOException {
		throw new InternalCompilerError("template argument left in expanded model");
	}

	@Override
	public Void visit(TemplateKeyReference templateKeyReference) throws IOException {
		throw new InternalCompilerError("template key reference left in expanded model");
	}

	@Override
	public Void visit(TemplateFieldReference templateFieldReference) throws IOException {
		throw new InternalCompilerError("template field reference left in expanded model");
	}

}
