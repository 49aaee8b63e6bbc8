package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleComparison extends CubicleBoolExpression {

	private final CubicleExpression lhs;
	private final String operator;
	private final CubicleExpression rhs;

	public CubicleComparison(SourceLocation location, CubicleExpression lhs, String operator, CubicleExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public CubicleExpression getLhs() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public CubicleExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleBoolExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleComparison other = (CubicleComparison) obj;
		return Objects.equals(lhs, other.lhs) && Objects.equals(operator, other.operator) && Objects.equals(rhs, other.rhs);
	}

}
