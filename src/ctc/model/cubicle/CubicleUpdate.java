package ctc.model.cubicle;

import ctc.util.SourceLocation;

public abstract class CubicleUpdate extends CubicleNode {

	public CubicleUpdate(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleUpdateVisitor<T, E> v) throws E;

}
