package works.vigil.exceptions;

/**
 * A hint can't be compiled because the hint itself is invalid.
 * Thrown at compile time, never while checking a value.
 */
public sealed abstract class InvalidSpecificationException extends VigilException permits
	UnsupportedSpecificationException,
	UnresolvedForwardReferenceException
{
	protected InvalidSpecificationException(String message) {
		super(message);
	}

	protected InvalidSpecificationException(String message, Throwable cause) {
		super(message, cause);
	}
}
