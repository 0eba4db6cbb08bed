package works.vigil.exceptions;

/**
 * A container node has a number of children that disagrees with its arity.
 * <p>
 * This indicates a bug in Vigil itself, not in the hint.
 * A correctly functioning scanner and reducer never produce such a node.
 */
public final class MalformedContainerArityException extends VigilException {
	public MalformedContainerArityException(String message) {
		super(message);
	}

	public MalformedContainerArityException(String message, Throwable cause) {
		super(message, cause);
	}
}
