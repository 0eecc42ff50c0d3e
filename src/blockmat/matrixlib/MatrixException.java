package blockmat.matrixlib;

// Root of the unchecked failures raised by the matrix classes
public class MatrixException extends RuntimeException {

	private static final long serialVersionUID = 4311846270235718503L;

	public MatrixException(String message) { super(message); }
	public MatrixException(String message, Throwable cause) { super(message, cause); }
}
