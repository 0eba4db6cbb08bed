package works.vigil.hint;

/**
 * Origin marker for hints built by {@link Hint#tuple}.
 * A tuple is a {@link java.util.List} whose size and per-position element types are fixed.
 * Never instantiated; only its class identity is significant.
 */
public final class Tuple {
	private Tuple() { }
}
