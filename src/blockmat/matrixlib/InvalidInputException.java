package blockmat.matrixlib;

// Input rejected by validation: wrong shape, not block triangular, malformed file data
public class InvalidInputException extends MatrixException {

	private static final long serialVersionUID = 6620473181275941157L;

	public InvalidInputException(String message) { super(message); }
	public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
