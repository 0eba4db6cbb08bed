package works.vigil.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.exceptions.InvalidSpecificationException;
import works.vigil.hint.Hint;
import works.vigil.reduce.Reducer;
import works.vigil.scan.SpecScanner;
import works.vigil.spec.ReducedSpec;
import works.vigil.spec.SpecNode;

import static java.util.Objects.requireNonNull;

/**
 * The compilation pipeline: scan, reduce, synthesize.
 * <p>
 * Every call does all the work from scratch;
 * use a {@link CheckerCache} to compile each hint only once.
 */
public class SpecCompiler {
	final CheckerSettings settings;

	public SpecCompiler(CheckerSettings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * @throws InvalidSpecificationException if {@code hint} can't be compiled
	 */
	public CompiledChecker compile(Object hint, Strategy strategy) {
		requireNonNull(strategy);
		LOGGER.debug("Compiling {} with strategy {}", Hint.describe(hint), strategy);
		SpecNode scanned = new SpecScanner(settings.getForwardScope()).scan(hint);
		LOGGER.debug("Scanned {}", scanned);
		ReducedSpec reduced = new Reducer().reduce(scanned);
		Checker checker = new CheckerSynthesizer(
			reduced,
			strategy,
			settings.getSampler(),
			settings.getIterationWindow(),
			settings.getRecursionLimit()
		).synthesize();
		return new CompiledChecker(hint, strategy, reduced, checker);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SpecCompiler.class);
}
