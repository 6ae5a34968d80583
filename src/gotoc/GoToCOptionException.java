package gotoc;

public class GoToCOptionException extends Exception {

	private static final long serialVersionUID = -3391858052411830551L;

	public GoToCOptionException(String msg) {
		super(msg);
	}

}
