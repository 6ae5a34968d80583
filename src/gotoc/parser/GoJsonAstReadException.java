package gotoc.parser;

import gotoc.GoToCException;

/**
 * The serialised tree could not be read: malformed JSON, a node kind that is not supported, or a node
 * missing one of its fields.
 */
public class GoJsonAstReadException extends GoToCException {

	private static final long serialVersionUID = 6018436772043121785L;
	private static final String prefix = "Input Error";

	public GoJsonAstReadException(String msg) {
		super(prefix, msg);
	}

	public GoJsonAstReadException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}

}
