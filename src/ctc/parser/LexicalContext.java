package ctc.parser;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ctc.util.SourceLocation;

public class LexicalContext {

	private final Path filePath;
	private final CharSequence chars;
	private int line;
	private int column;
	private int index;

	public static class Mark {
		private final int markedLine;
		private final int markedColumn;
		private final int markedIndex;

		public Mark(int markedLine, int markedColumn, int markedIndex) {
			this.markedLine = markedLine;
			this.markedColumn = markedColumn;
			this.markedIndex = markedIndex;
		}

		public int getMarkedLine() { return markedLine; }
		public int getMarkedColumn() { return markedColumn; }
		public int getMarkedIndex() { return markedIndex; }
	}

	public LexicalContext(Path filePath, CharSequence chars) {
		this.filePath = filePath;
		this.chars = chars;
		this.line = 0;
		this.column = 0;
		this.index = 0;
	}

	public Mark mark() {
		return new Mark(line, column, index);
	}

	public void restore(Mark mark) {
		line = mark.getMarkedLine();
		column = mark.getMarkedColumn();
		index = mark.getMarkedIndex();
	}

	private void advance(int length) {
		for (int i = 0; i < length; ++i) {
			if (chars.charAt(index) == '\n') {
				++line;
				column = 0;
			} else {
				++column;
			}
			++index;
		}
	}

	/**
	 * Attempts to match {@code pattern} at the current position, consuming the match on success.
	 * @param pattern the pattern to match
	 * @return the result of the match, or empty on failure
	 */
	public Optional<MatchResult> matchPattern(Pattern pattern) {
		if (index > chars.length()) return Optional.empty();
		Matcher m = pattern.matcher(chars);
		m.region(index, chars.length());
		if (m.lookingAt()) {
			MatchResult result = m.toMatchResult();
			advance(result.end() - result.start());
			return Optional.of(result);
		} else {
			return Optional.empty();
		}
	}

	public boolean lookingAt(String string) {
		return index + string.length() <= chars.length()
				&& string.contentEquals(chars.subSequence(index, index + string.length()));
	}

	public boolean matchString(String string) {
		if (lookingAt(string)) {
			advance(string.length());
			return true;
		}
		return false;
	}

	/**
	 * @return the current character, or 0 at the end of input
	 */
	public char peek() {
		return isEOF() ? 0 : chars.charAt(index);
	}

	public void skip() {
		advance(1);
	}

	public SourceLocation getSourceLocation() {
		return new SourceLocation(filePath, index, index, line + 1, column + 1);
	}

	/**
	 * @return the location spanning from start to the current position
	 */
	public SourceLocation locationFrom(Mark start) {
		return new SourceLocation(filePath, start.getMarkedIndex(), index, start.getMarkedLine() + 1,
				start.getMarkedColumn() + 1);
	}

	public int getLine() {
		return line + 1;
	}

	public int getColumn() {
		return column + 1;
	}

	public boolean isEOF() {
		return index >= chars.length();
	}

}
