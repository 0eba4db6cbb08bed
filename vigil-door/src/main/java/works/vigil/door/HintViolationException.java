package works.vigil.door;

import org.jetbrains.annotations.Nullable;
import works.vigil.hint.Hint;
import works.vigil.report.Diagnostic;

/**
 * A value doesn't conform to a hint it was required to conform to.
 */
public class HintViolationException extends RuntimeException {
	private final transient Object hint;
	private final transient Diagnostic diagnostic;

	public HintViolationException(@Nullable Object hint, Diagnostic diagnostic) {
		super("Value violates " + Hint.describe(hint) + ": " + diagnostic.message());
		this.hint = hint;
		this.diagnostic = diagnostic;
	}

	public Object hint() {
		return hint;
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
