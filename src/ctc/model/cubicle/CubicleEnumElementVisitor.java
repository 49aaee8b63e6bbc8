package ctc.model.cubicle;

public abstract class CubicleEnumElementVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleEnumName enumName) throws E;
	public abstract T visit(CubicleEnumIterator enumIterator) throws E;
}
