package blockmat.matrixlib;

// A matrix or block that had to be invertible was not
public class SingularMatrixException extends MatrixException {

	private static final long serialVersionUID = -2178863510952217046L;

	public SingularMatrixException(String message) { super(message); }
}
