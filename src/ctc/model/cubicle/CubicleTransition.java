package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleTransition extends CubicleConstruct {

	private final CubicleName name;
	private final List<String> processes;
	private final CubicleOrExpression guard;
	private final List<CubicleUpdate> updates;

	public CubicleTransition(SourceLocation location, TemplateDeclaration declaration, CubicleName name,
	                         List<String> processes, CubicleOrExpression guard, List<CubicleUpdate> updates) {
		super(location, declaration);
		this.name = name;
		this.processes = processes;
		this.guard = guard;
		this.updates = updates;
	}

	public CubicleName getName() {
		return name;
	}

	public List<String> getProcesses() {
		return processes;
	}

	/**
	 * @return the requires clause, or null if the transition has none
	 */
	public CubicleOrExpression getGuard() {
		return guard;
	}

	public List<CubicleUpdate> getUpdates() {
		return updates;
	}

	@Override
	public String getKeyword() {
		return "transition";
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDeclaration(), name, processes, guard, updates);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleTransition other = (CubicleTransition) obj;
		return Objects.equals(getDeclaration(), other.getDeclaration()) && Objects.equals(name, other.name) &&
				Objects.equals(processes, other.processes) && Objects.equals(guard, other.guard) &&
				Objects.equals(updates, other.updates);
	}

}
