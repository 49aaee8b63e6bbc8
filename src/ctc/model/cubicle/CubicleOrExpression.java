package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleOrExpression extends CubicleNode {

	private final List<CubicleOrElement> elements;

	public CubicleOrExpression(SourceLocation location, List<CubicleOrElement> elements) {
		super(location);
		this.elements = elements;
	}

	public List<CubicleOrElement> getElements() {
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
		CubicleOrExpression other = (CubicleOrExpression) obj;
		return Objects.equals(elements, other.elements);
	}

}
