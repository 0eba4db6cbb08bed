package works.vigil.hint;

/**
 * Origin marker for hints built by {@link Hint#union}.
 * Never instantiated; only its class identity is significant.
 */
public final class Union {
	private Union() { }
}
