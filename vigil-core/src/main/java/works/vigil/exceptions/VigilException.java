package works.vigil.exceptions;

public sealed abstract class VigilException extends RuntimeException permits InvalidSpecificationException, MalformedContainerArityException {
	protected VigilException(String message) {
		super(message);
	}

	protected VigilException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same class as {@code exception}, with {@code context}
	 * prepended to its message, and {@code exception} as its cause
	 */
	@SuppressWarnings("unchecked")
	public static <T extends VigilException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof UnsupportedSpecificationException e) {
			return (T) new UnsupportedSpecificationException(e.specification(), newMessage, e);
		} else if (exception instanceof UnresolvedForwardReferenceException e) {
			return (T) new UnresolvedForwardReferenceException(e.referenceName(), newMessage, e);
		} else if (exception instanceof MalformedContainerArityException e) {
			return (T) new MalformedContainerArityException(newMessage, e);
		} else {
			throw new IllegalStateException("Unexpected exception type: " + exception.getClass(), exception);
		}
	}
}
