package works.vigil.spec;

/**
 * The bottom type. Has no instances, so an {@link AtomicNode} of this class accepts nothing.
 */
public final class Nothing {
	private Nothing() {
		throw new AssertionError("Nothing can't be instantiated");
	}
}
