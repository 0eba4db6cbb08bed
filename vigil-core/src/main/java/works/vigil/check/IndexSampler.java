package works.vigil.check;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The source of the indexes a {@link Strategy#SAMPLING sampling} checker examines.
 * <p>
 * Implementations must be thread-safe, because a checker may be called concurrently.
 */
@FunctionalInterface
public interface IndexSampler {
	/**
	 * @param bound strictly positive
	 * @return a number from zero (inclusive) to {@code bound} (exclusive)
	 */
	int nextIndex(int bound);

	IndexSampler RANDOM = bound -> ThreadLocalRandom.current().nextInt(bound);

	/**
	 * For reproducible tests.
	 */
	static IndexSampler seeded(long seed) {
		Random random = new Random(seed);
		return random::nextInt;
	}

	/**
	 * Always picks the same index, or the last one if {@code index} is out of bounds.
	 */
	static IndexSampler fixed(int index) {
		return bound -> Math.min(index, bound - 1);
	}
}
