package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleOrBranch extends CubicleOrElement {

	private final CubicleAndExpression branch;

	public CubicleOrBranch(SourceLocation location, CubicleAndExpression branch) {
		super(location);
		this.branch = branch;
	}

	public CubicleAndExpression getBranch() {
		return branch;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleOrElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(branch);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleOrBranch other = (CubicleOrBranch) obj;
		return Objects.equals(branch, other.branch);
	}

}
