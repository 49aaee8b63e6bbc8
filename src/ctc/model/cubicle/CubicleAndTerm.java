package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleAndTerm extends CubicleAndElement {

	private final CubicleBoolExpression expression;

	public CubicleAndTerm(SourceLocation location, CubicleBoolExpression expression) {
		super(location);
		this.expression = expression;
	}

	public CubicleBoolExpression getExpression() {
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
		CubicleAndTerm other = (CubicleAndTerm) obj;
		return Objects.equals(expression, other.expression);
	}

}
