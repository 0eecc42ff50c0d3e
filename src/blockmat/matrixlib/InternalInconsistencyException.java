package blockmat.matrixlib;

// Raised by the block recursion when a diagonal block turns out singular.
// Cannot happen for an invertible block triangular input, so the caller's invertibility claim was false.
public class InternalInconsistencyException extends MatrixException {

	private static final long serialVersionUID = -5532750817064829371L;

	private final Object label;

	public InternalInconsistencyException(String message, Object label, Throwable cause) {
		super(message, cause);
		this.label = label;
	}

	// label of the offending diagonal block
	public Object getLabel() { return label; }
}
