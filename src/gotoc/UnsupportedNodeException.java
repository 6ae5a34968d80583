package gotoc;

/**
 * Thrown when the tree contains a shape C emission does not support, such as a function with more than one
 * result or an assignment with several targets. Emission stops at the first one.
 */
public class UnsupportedNodeException extends GoToCException {

	private static final long serialVersionUID = 4127330907418350413L;
	private static final String prefix = "Unsupported Input";

	public UnsupportedNodeException(String msg) {
		super(prefix, msg);
	}

}
