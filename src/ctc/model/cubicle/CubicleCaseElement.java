package ctc.model.cubicle;

import ctc.util.SourceLocation;

public abstract class CubicleCaseElement extends CubicleNode {

	public CubicleCaseElement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleCaseElementVisitor<T, E> v) throws E;

}
