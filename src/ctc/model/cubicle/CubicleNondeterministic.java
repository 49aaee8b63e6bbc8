package ctc.model.cubicle;

import ctc.util.SourceLocation;

/**
 * The "?" right-hand side: any value of the variable's type.
 */
public class CubicleNondeterministic extends CubicleAssignValue {

	public CubicleNondeterministic(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleAssignValueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return CubicleNondeterministic.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

}
