package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleAndNestedOr extends CubicleAndElement {

	private final CubicleOrExpression expression;

	public CubicleAndNestedOr(SourceLocation location, CubicleOrExpression expression) {
		super(location);
		this.expression = expression;
	}

	public CubicleOrExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleAndElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleAndNestedOr other = (CubicleAndNestedOr) obj;
		return Objects.equals(expression, other.expression);
	}

}
