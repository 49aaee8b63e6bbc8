package ctc.model.cubicle;

import ctc.Unreachable;
import ctc.formatters.CubicleNodeFormattingVisitor;
import ctc.formatters.IndentingWriter;
import ctc.util.SourceLocatable;
import ctc.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base of every node of a Cubicle template. The same node classes describe both the raw
 * template and the expanded model; an expanded model contains no template declaration, no
 * iterator element and only literal names.
 *
 * Equality ignores source locations.
 */
public abstract class CubicleNode extends SourceLocatable {

	private final SourceLocation location;

	public CubicleNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new CubicleNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
