package ctc;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String what) {
		super("internal compiler error: " + what);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
