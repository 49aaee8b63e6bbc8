package ctc.model.template;

public abstract class TemplateReferenceVisitor<T, E extends Throwable> {
	public abstract T visit(TemplateArgument argument) throws E;
	public abstract T visit(TemplateKeyReference keyReference) throws E;
	public abstract T visit(TemplateFieldReference fieldReference) throws E;
}
