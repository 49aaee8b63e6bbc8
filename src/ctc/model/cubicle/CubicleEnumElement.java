package ctc.model.cubicle;

import ctc.util.SourceLocation;

public abstract class CubicleEnumElement extends CubicleNode {

	public CubicleEnumElement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleEnumElementVisitor<T, E> v) throws E;

}
