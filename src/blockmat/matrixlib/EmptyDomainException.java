package blockmat.matrixlib;

// An extreme label was requested from an empty index set
public class EmptyDomainException extends MatrixException {

	private static final long serialVersionUID = 1905337268106243322L;

	public EmptyDomainException(String message) { super(message); }
}
