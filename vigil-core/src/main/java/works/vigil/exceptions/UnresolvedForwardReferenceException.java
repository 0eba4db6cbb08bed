package works.vigil.exceptions;

/**
 * A {@link works.vigil.hint.ForwardRef forward reference} names nothing in its scope,
 * or refers to itself without an intervening container, so that checking it could never terminate.
 */
public final class UnresolvedForwardReferenceException extends InvalidSpecificationException {
	private final String referenceName;

	public UnresolvedForwardReferenceException(String referenceName, String message) {
		super(message);
		this.referenceName = referenceName;
	}

	public UnresolvedForwardReferenceException(String referenceName, String message, Throwable cause) {
		super(message, cause);
		this.referenceName = referenceName;
	}

	public String referenceName() {
		return referenceName;
	}
}
