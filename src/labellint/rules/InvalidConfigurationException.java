package labellint.rules;

public class InvalidConfigurationException extends Exception {

	private static final long serialVersionUID = -2365870131530384511L;

	public InvalidConfigurationException(String msg) {
		super(msg);
	}
}
