package ctc.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Position of a parsed node in its template file. Lines and columns are 1-based.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int line;
	private final int column;

	public SourceLocation(Path file, int startOffset, int endOffset, int line, int column) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.line = line;
		this.column = column;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return line == -1;
	}

	/**
	 * @return a location spanning from the start of this one to the end of other
	 */
	public SourceLocation extendTo(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		return new SourceLocation(file, startOffset, Integer.max(endOffset, other.endOffset), line, column);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, line, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset && line == other.line &&
				column == other.column && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
				", line=" + line + ", column=" + column + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		int comparedColumn = Integer.compare(column, o.column);
		if (comparedColumn != 0) {
			return comparedColumn;
		}
		return Integer.compare(endOffset, o.endOffset);
	}

}
