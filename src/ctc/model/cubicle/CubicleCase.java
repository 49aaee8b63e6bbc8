package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

/**
 * | guard : value. The wildcard case "_" has no guard.
 */
public class CubicleCase extends CubicleCaseElement {

	private final CubicleAndExpression guard;
	private final CubicleExpression value;

	public CubicleCase(SourceLocation location, CubicleAndExpression guard, CubicleExpression value) {
		super(location);
		this.guard = guard;
		this.value = value;
	}

	public CubicleAndExpression getGuard() {
		return guard;
	}

	public CubicleExpression getValue() {
		return value;
	}

	public boolean isWildcard() {
		return guard == null;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleCaseElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(guard, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleCase other = (CubicleCase) obj;
		return Objects.equals(guard, other.guard) && Objects.equals(value, other.value);
	}

}
