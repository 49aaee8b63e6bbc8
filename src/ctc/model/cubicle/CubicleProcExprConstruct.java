package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * The common shape of init, invariant and unsafe: kind (p1 p2 ...) { formula }
 */
public class CubicleProcExprConstruct extends CubicleConstruct {

	public enum Kind {
		INIT("init"),
		INVARIANT("invariant"),
		UNSAFE("unsafe");

		private final String keyword;

		Kind(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final Kind kind;
	private final List<String> processes;
	private final CubicleOrExpression formula;

	public CubicleProcExprConstruct(SourceLocation location, TemplateDeclaration declaration, Kind kind,
	                                List<String> processes, CubicleOrExpression formula) {
		super(location, declaration);
		this.kind = kind;
		this.processes = processes;
		this.formula = formula;
	}

	public Kind getKind() {
		return kind;
	}

	public List<String> getProcesses() {
		return processes;
	}

	public CubicleOrExpression getFormula() {
		return formula;
	}

	@Override
	public String getKeyword() {
		return kind.getKeyword();
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDeclaration(), kind, processes, formula);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleProcExprConstruct other = (CubicleProcExprConstruct) obj;
		return Objects.equals(getDeclaration(), other.getDeclaration()) && kind == other.kind &&
				Objects.equals(processes, other.processes) && Objects.equals(formula, other.formula);
	}

}
