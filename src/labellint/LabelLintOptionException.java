package labellint;

public class LabelLintOptionException extends Exception {

	private static final long serialVersionUID = 8079934915187650377L;

	public LabelLintOptionException(String msg) {
		super(msg);
	}
}
