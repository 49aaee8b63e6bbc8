package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

/**
 * forall_other p. comparison, or forall_other p. (formula). Exactly one of comparison and
 * formula is non-null.
 */
public class CubicleForallOther extends CubicleBoolExpression {

	private final String process;
	private final CubicleComparison comparison;
	private final CubicleOrExpression formula;

	public CubicleForallOther(SourceLocation location, String process, CubicleComparison comparison) {
		super(location);
		this.process = process;
		this.comparison = comparison;
		this.formula = null;
	}

	public CubicleForallOther(SourceLocation location, String process, CubicleOrExpression formula) {
		super(location);
		this.process = process;
		this.comparison = null;
		this.formula = formula;
	}

	public String getProcess() {
		return process;
	}

	public CubicleComparison getComparison() {
		return comparison;
	}

	public CubicleOrExpression getFormula() {
		return formula;
	}

	public boolean hasFormula() {
		return formula != null;
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
		return Objects.hash(process, comparison, formula);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleForallOther other = (CubicleForallOther) obj;
		return process.equals(other.process) && Objects.equals(comparison, other.comparison) &&
				Objects.equals(formula, other.formula);
	}

}
