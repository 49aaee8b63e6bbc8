package ctc.model.cubicle;

public abstract class CubicleAndElementVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleAndTerm andTerm) throws E;
	public abstract T visit(CubicleAndNestedOr andNestedOr) throws E;
	public abstract T visit(CubicleAndIterator andIterator) throws E;
}
