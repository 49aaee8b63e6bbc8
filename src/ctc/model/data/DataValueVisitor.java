package ctc.model.data;

public abstract class DataValueVisitor<T, E extends Throwable> {
	public abstract T visit(DataMapping dataMapping) throws E;
	public abstract T visit(DataSequence dataSequence) throws E;
	public abstract T visit(DataScalar dataScalar) throws E;
}
