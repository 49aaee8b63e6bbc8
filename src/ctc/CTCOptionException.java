package ctc;

public class CTCOptionException extends CTCException {

	private static final long serialVersionUID = 4716533024583105632L;
	private static final String prefix = "Option Error";

	public CTCOptionException(String msg) {
		super(prefix, msg);
	}

}
