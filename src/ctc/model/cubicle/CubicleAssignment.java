package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleAssignment extends CubicleUpdate {

	private final CubicleReference lhs;
	private final CubicleAssignValue rhs;

	public CubicleAssignment(SourceLocation location, CubicleReference lhs, CubicleAssignValue rhs) {
		super(location);
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public CubicleReference getLhs() {
		return lhs;
	}

	public CubicleAssignValue getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleUpdateVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleAssignment other = (CubicleAssignment) obj;
		return Objects.equals(lhs, other.lhs) && Objects.equals(rhs, other.rhs);
	}

}
