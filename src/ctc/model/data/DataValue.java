package ctc.model.data;

import ctc.Unreachable;
import ctc.formatters.DataValueFormattingVisitor;
import ctc.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A value of the data environment: a mapping, a sequence or a scalar. Values are
 * immutable and converted once from their external representation.
 */
public abstract class DataValue {

	public abstract <T, E extends Throwable> T accept(DataValueVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			accept(new DataValueFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
