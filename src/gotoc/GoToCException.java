package gotoc;

/**
 * A gotoc Exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class GoToCException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public GoToCException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public GoToCException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
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
