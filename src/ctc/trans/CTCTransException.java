package ctc.trans;

import ctc.CTCException;

/**
 * Exception during template AST to Cubicle AST expansion
 *
 */
public class CTCTransException extends CTCException {

	private static final long serialVersionUID = -3125907364402738119L;
	private static final String prefix = "Expansion Error";

	public CTCTransException(String msg) {
		super(prefix, msg);
	}

}
