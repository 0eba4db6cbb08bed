package works.vigil.hint;

/**
 * Origin marker for hints built by {@link Hint#annotated}.
 * Never instantiated; only its class identity is significant.
 */
public final class Annotated {
	private Annotated() { }
}
