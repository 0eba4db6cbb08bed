package works.vigil.exceptions;

import works.vigil.hint.Hint;

/**
 * A hint, or some hint nested inside it, has a shape that no classification rule recognizes,
 * or is subscripted by the wrong number of arguments.
 */
public final class UnsupportedSpecificationException extends InvalidSpecificationException {
	private final Object specification;

	public UnsupportedSpecificationException(Object specification, String message) {
		super(message);
		this.specification = specification;
	}

	public UnsupportedSpecificationException(Object specification, String message, Throwable cause) {
		super(message, cause);
		this.specification = specification;
	}

	public static UnsupportedSpecificationException of(Object specification, String reason) {
		return new UnsupportedSpecificationException(specification, "Unsupported hint " + Hint.describe(specification) + ": " + reason);
	}

	/**
	 * @return the offending (sub-)hint
	 */
	public Object specification() {
		return specification;
	}
}
