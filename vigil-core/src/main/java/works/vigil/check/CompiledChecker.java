package works.vigil.check;

import org.jetbrains.annotations.Nullable;
import works.vigil.hint.Hint;
import works.vigil.report.Diagnostic;
import works.vigil.report.ViolationReporter;
import works.vigil.spec.ReducedSpec;

/**
 * A hint compiled into a {@link Checker}, along with the {@link ReducedSpec}
 * it was synthesized from, which is kept for {@link #explainViolation explaining} failures.
 * <p>
 * Immutable and thread-safe.
 */
public final class CompiledChecker {
	private final Object hint;
	private final Strategy strategy;
	private final ReducedSpec spec;
	private final Checker checker;

	CompiledChecker(Object hint, Strategy strategy, ReducedSpec spec, Checker checker) {
		this.hint = hint;
		this.strategy = strategy;
		this.spec = spec;
		this.checker = checker;
	}

	/**
	 * @return true if {@code value} conforms to the hint, as far as this checker's
	 * {@link Strategy} can tell
	 */
	public boolean check(@Nullable Object value) {
		return checker.check(value);
	}

	/**
	 * Examines all of {@code value}, regardless of this checker's {@link Strategy}.
	 *
	 * @return the first violation found, or {@link Diagnostic#NONE} if {@code value} conforms
	 */
	public Diagnostic explainViolation(@Nullable Object value) {
		return ViolationReporter.explain(spec, value);
	}

	public Object hint() {
		return hint;
	}

	public Strategy strategy() {
		return strategy;
	}

	public ReducedSpec spec() {
		return spec;
	}

	@Override
	public String toString() {
		return "CompiledChecker[" + Hint.describe(hint) + " as " + spec + ", " + strategy + "]";
	}
}
