package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A whole Cubicle program, in source order:
 * [number_procs N] type* declaration* init invariant* unsafe* transition*
 */
public class CubicleModel extends CubicleNode {

	private final String processCount;
	private final List<CubicleTypeDeclaration> types;
	private final List<CubicleVariableDeclaration> declarations;
	private final CubicleProcExprConstruct init;
	private final List<CubicleProcExprConstruct> invariants;
	private final List<CubicleProcExprConstruct> unsafes;
	private final List<CubicleTransition> transitions;

	public CubicleModel(SourceLocation location, String processCount, List<CubicleTypeDeclaration> types,
	                    List<CubicleVariableDeclaration> declarations, CubicleProcExprConstruct init,
	                    List<CubicleProcExprConstruct> invariants, List<CubicleProcExprConstruct> unsafes,
	                    List<CubicleTransition> transitions) {
		super(location);
		this.processCount = processCount;
		this.types = types;
		this.declarations = declarations;
		this.init = init;
		this.invariants = invariants;
		this.unsafes = unsafes;
		this.transitions = transitions;
	}

	/**
	 * @return the number_procs value, or null if the model does not set it
	 */
	public String getProcessCount() {
		return processCount;
	}

	public List<CubicleTypeDeclaration> getTypes() {
		return types;
	}

	public List<CubicleVariableDeclaration> getDeclarations() {
		return declarations;
	}

	public CubicleProcExprConstruct getInit() {
		return init;
	}

	public List<CubicleProcExprConstruct> getInvariants() {
		return invariants;
	}

	public List<CubicleProcExprConstruct> getUnsafes() {
		return unsafes;
	}

	public List<CubicleTransition> getTransitions() {
		return transitions;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(processCount, types, declarations, init, invariants, unsafes, transitions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleModel other = (CubicleModel) obj;
		return Objects.equals(processCount, other.processCount) && Objects.equals(types, other.types) &&
				Objects.equals(declarations, other.declarations) && Objects.equals(init, other.init) &&
				Objects.equals(invariants, other.invariants) && Objects.equals(unsafes, other.unsafes) &&
				Objects.equals(transitions, other.transitions);
	}

}
