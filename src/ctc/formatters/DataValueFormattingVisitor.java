package ctc.formatters;

import ctc.model.data.DataMapping;
import ctc.model.data.DataScalar;
import ctc.model.data.DataSequence;
import ctc.model.data.DataValue;
import ctc.model.data.DataValueVisitor;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

public class DataValueFormattingVisitor extends DataValueVisitor<Void, IOException> {

	private final IndentingWriter out;

	public DataValueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(DataMapping dataMapping) throws IOException {
		out.write("{");
		boolean first = true;
		for (Map.Entry<String, DataValue> entry : new TreeMap<>(dataMapping.getEntries()).entrySet()) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			out.write(entry.getKey());
			out.write(": ");
			entry.getValue().accept(this);
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(DataSequence dataSequence) throws IOException {
		out.write("[");
		boolean first = true;
		for (DataValue element : dataSequence.getElements()) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			element.accept(this);
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(DataScalar dataScalar) throws IOException {
		out.write(dataScalar.getText());
		return null;
	}

}
