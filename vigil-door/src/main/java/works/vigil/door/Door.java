package works.vigil.door;

import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.check.CheckerCache;
import works.vigil.check.CheckerSettings;
import works.vigil.check.CompiledChecker;
import works.vigil.exceptions.InvalidSpecificationException;
import works.vigil.report.Diagnostic;

/**
 * Statement-level checks of arbitrary values against arbitrary hints.
 * <p>
 * Hints are compiled on first use by the {@link CheckerCache} and reused thereafter,
 * so a {@code Door} should be long-lived, and hints should be constants
 * rather than objects rebuilt at each call.
 */
@RequiredArgsConstructor
public class Door {
	private final CheckerCache cache;

	public static Door withSettings(CheckerSettings settings) {
		return new Door(new CheckerCache(settings));
	}

	public CheckerCache cache() {
		return cache;
	}

	/**
	 * @throws InvalidSpecificationException if {@code hint} can't be compiled
	 */
	public boolean isBearable(@Nullable Object value, @Nullable Object hint) {
		return cache.getOrCompile(hint).check(value);
	}

	/**
	 * @return {@code value}, for chaining
	 * @throws HintViolationException if {@code value} doesn't conform to {@code hint}
	 * @throws InvalidSpecificationException if {@code hint} can't be compiled
	 */
	public <T> T dieIfUnbearable(T value, @Nullable Object hint) {
		CompiledChecker checker = cache.getOrCompile(hint);
		if (!checker.check(value)) {
			Diagnostic diagnostic = checker.explainViolation(value);
			if (!diagnostic.isViolation()) {
				// Only a predicate that changes its mind could cause this
				LOGGER.warn("Checker rejected a value that the reporter accepts for {}", checker);
			}
			throw new HintViolationException(hint, diagnostic);
		}
		return value;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Door.class);
}
