package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleExpressionValue extends CubicleAssignValue {

	private final CubicleExpression expression;

	public CubicleExpressionValue(SourceLocation location, CubicleExpression expression) {
		super(location);
		this.expression = expression;
	}

	public CubicleExpression getExpression() {
		return expression;
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
		CubicleExpressionValue other = (CubicleExpressionValue) obj;
		return Objects.equals(expression, other.expression);
	}

}
