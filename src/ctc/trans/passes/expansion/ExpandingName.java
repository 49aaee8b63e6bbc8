package ctc.trans.passes.expansion;

import ctc.errors.Context;
import ctc.errors.ContextVisitor;
import ctc.model.cubicle.CubicleName;

public class ExpandingName extends Context {

	private final CubicleName name;

	public ExpandingName(CubicleName name) {
		this.name = name;
	}

	public CubicleName getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
