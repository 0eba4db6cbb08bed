package works.vigil.hint;

/**
 * Builtin hints recognized by identity.
 */
public enum Sentinel {
	/**
	 * Accepts every value, including {@code null}.
	 */
	ANY,

	/**
	 * Accepts only {@code null}.
	 */
	NONE,

	/**
	 * Accepts no value at all.
	 */
	NOTHING
}
