package ctc.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A Writer that prefixes every line with the current indentation. Lines are always
 * terminated with '\n' so that generated Cubicle files do not depend on the platform.
 */
public class IndentingWriter extends Writer {

	private static final String NEWLINE = "\n";

	private final Writer out;
	private final String indentUnit;
	private int level = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;

		public Indent(IndentingWriter writer) {
			this.writer = writer;
		}

		@Override
		public void close() {
			writer.unindent();
		}

	}

	public IndentingWriter(Writer out) {
		this(out, "    ");
	}

	public IndentingWriter(Writer out, String indentUnit) {
		this.out = out;
		this.indentUnit = indentUnit;
	}

	public Indent indent() {
		level++;
		return new Indent(this);
	}

	public void unindent() {
		if (level == 0) {
			throw new RuntimeException("can't unindent below 0");
		}
		level--;
	}

	public void newLine() throws IOException {
		write(NEWLINE);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (shouldIndent) {
				for (int i = 0; i < level; ++i) {
					out.write(indentUnit);
				}
				shouldIndent = false;
			}
			int next = data.indexOf(NEWLINE, start);
			if (next == -1) {
				out.write(data.substring(start));
				break;
			}
			out.write(data.substring(start, next + NEWLINE.length()));
			start = next + NEWLINE.length();
			shouldIndent = true;
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

}
