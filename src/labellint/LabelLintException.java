package labellint;

/**
 * A labellint failure consisting of a prefix (the kind of failure) and a message.
 */
public abstract class LabelLintException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public LabelLintException(String prefix, String msg) {
		super(prefix.isEmpty() ? msg : prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
