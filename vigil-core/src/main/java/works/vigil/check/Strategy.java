package works.vigil.check;

/**
 * How thoroughly a synthesized {@link Checker} examines the contents of containers.
 */
public enum Strategy {
	/**
	 * Checks one pseudo-randomly chosen element of each container at each nesting level,
	 * so every call costs the same regardless of the size of the value.
	 * A violation in a large container may go unnoticed on any single call,
	 * but is found with high probability over repeated calls.
	 */
	SAMPLING,

	/**
	 * Checks every element. Linear in the size of the value.
	 * The value must be acyclic.
	 */
	EXHAUSTIVE,

	/**
	 * Accepts everything. The hint is still compiled, so invalid hints are still reported.
	 */
	DISABLED,
}
