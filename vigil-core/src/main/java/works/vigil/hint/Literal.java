package works.vigil.hint;

/**
 * Origin marker for hints built by {@link Hint#literal}.
 * Never instantiated; only its class identity is significant.
 */
public final class Literal {
	private Literal() { }
}
