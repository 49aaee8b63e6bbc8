package ctc.model.cubicle;

import ctc.util.SourceLocation;

public abstract class CubicleAssignValue extends CubicleNode {

	public CubicleAssignValue(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleAssignValueVisitor<T, E> v) throws E;

}
