package ctc.parser;

import ctc.CTCException;

/**
 * Syntax error in a Cubicle template
 *
 */
public class TemplateParseException extends CTCException {

	private static final long serialVersionUID = 6519233710472561086L;
	private static final String prefix = "Parse Error";

	private final int column;

	public TemplateParseException(String msg, int line, int column) {
		super(prefix, msg + ", column " + column, line);
		this.column = column;
	}

	public int getColumn() {
		return column;
	}

}
