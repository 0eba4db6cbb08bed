package works.vigil.check;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.exceptions.InvalidSpecificationException;
import works.vigil.report.Diagnostic;

import static java.util.Objects.requireNonNull;

/**
 * Compiles each hint at most once, and hands out the same {@link CompiledChecker}
 * to every caller thereafter.
 * <p>
 * Hints are keyed by identity, not equality: two equal hint objects
 * are compiled separately. A hint must not be mutated after its first use.
 * Entries are never evicted.
 * <p>
 * Thread-safe. When several threads ask for the same uncompiled hint at once,
 * one of them compiles it while the others wait.
 * Once compiled, a lookup costs a map lookup and a volatile read.
 */
public class CheckerCache {
	final CheckerSettings settings;
	final SpecCompiler compiler;
	final ConcurrentMap<IdentityKey, Entry> entries = new ConcurrentHashMap<>();
	final AtomicLong compilationCount = new AtomicLong(0);

	public CheckerCache(CheckerSettings settings) {
		this.settings = requireNonNull(settings);
		this.compiler = new SpecCompiler(settings);
	}

	public CheckerSettings settings() {
		return settings;
	}

	/**
	 * Uses the {@link CheckerSettings#getStrategy() default strategy}.
	 *
	 * @throws InvalidSpecificationException if {@code hint} can't be compiled
	 */
	public CompiledChecker getOrCompile(@Nullable Object hint) {
		return getOrCompile(hint, settings.getStrategy());
	}

	/**
	 * @throws InvalidSpecificationException if {@code hint} can't be compiled.
	 * Failures aren't cached, so a later call will try again.
	 */
	public CompiledChecker getOrCompile(@Nullable Object hint, Strategy strategy) {
		IdentityKey key = new IdentityKey(hint, requireNonNull(strategy));
		return entries.computeIfAbsent(key, k -> new Entry()).get(hint, strategy);
	}

	/**
	 * @return the first violation of {@code hint} in {@code value},
	 * or {@link Diagnostic#NONE} if there is none
	 */
	public Diagnostic explainViolation(@Nullable Object hint, @Nullable Object value) {
		return getOrCompile(hint).explainViolation(value);
	}

	/**
	 * @return the number of successful compilations this cache has performed
	 */
	public long compilationCount() {
		return compilationCount.get();
	}

	/**
	 * @return the number of distinct (hint, strategy) keys seen,
	 * including any whose compilation failed
	 */
	public int size() {
		return entries.size();
	}

	/**
	 * Compares hints by identity. {@link System#identityHashCode} is zero for {@code null}.
	 */
	record IdentityKey(Object hint, Strategy strategy) {
		@Override
		public boolean equals(Object obj) {
			return obj instanceof IdentityKey other
				&& other.hint == this.hint
				&& other.strategy == this.strategy;
		}

		@Override
		public int hashCode() {
			return 31 * System.identityHashCode(hint) + strategy.hashCode();
		}
	}

	/**
	 * Lazily initialized. We don't compile inside {@link ConcurrentHashMap#computeIfAbsent}
	 * because that would hold a lock on part of the map for the duration of the compilation.
	 */
	final class Entry {
		private volatile CompiledChecker checker;

		CompiledChecker get(Object hint, Strategy strategy) {
			CompiledChecker result = checker;
			if (result != null) {
				return result;
			}
			synchronized (this) {
				if (checker == null) {
					CompiledChecker compiled = compiler.compile(hint, strategy);
					compilationCount.incrementAndGet();
					LOGGER.debug("Published {}", compiled);
					checker = compiled;
				}
				return checker;
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CheckerCache.class);
}
