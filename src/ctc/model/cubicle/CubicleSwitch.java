package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleSwitch extends CubicleAssignValue {

	private final List<CubicleCaseElement> cases;

	public CubicleSwitch(SourceLocation location, List<CubicleCaseElement> cases) {
		super(location);
		this.cases = cases;
	}

	public List<CubicleCaseElement> getCases() {
		return cases;
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
		return Objects.hash(cases);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleSwitch other = (CubicleSwitch) obj;
		return Objects.equals(cases, other.cases);
	}

}
