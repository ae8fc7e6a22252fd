package labellint.parser;

/**
 * SourceKitten output that is not valid JSON or does not have the expected shape.
 */
public class SourceKittenParseException extends Exception {

	private static final long serialVersionUID = 4311508272416357032L;

	public SourceKittenParseException(String msg) {
		super(msg);
	}

	public SourceKittenParseException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
