package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleAndExpression extends CubicleNode {

	private final List<CubicleAndElement> elements;

	public CubicleAndExpression(SourceLocation location, List<CubicleAndElement> elements) {
		super(location);
		this.elements = elements;
	}

	public List<CubicleAndElement> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleAndExpression other = (CubicleAndExpression) obj;
		return Objects.equals(elements, other.elements);
	}

}
