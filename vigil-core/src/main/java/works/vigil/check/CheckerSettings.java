package works.vigil.check;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.vigil.hint.ForwardScope;

@Value
@Builder(toBuilder = true)
public class CheckerSettings {
	public static final CheckerSettings DEFAULT = CheckerSettings.builder().build();

	/**
	 * Used when {@link CheckerCache#getOrCompile(Object)} is called without a strategy.
	 */
	@Default Strategy strategy = Strategy.SAMPLING;

	/**
	 * Where string and {@link works.vigil.hint.ForwardRef ForwardRef} hints are resolved.
	 * The default is {@link ForwardScope#EMPTY}, which can't be added to;
	 * supply a scope from {@link ForwardScope#create()} to define names.
	 */
	@Default ForwardScope forwardScope = ForwardScope.EMPTY;

	@Default IndexSampler sampler = IndexSampler.RANDOM;

	/**
	 * Containers that can only be reached by iteration, like sets and maps,
	 * are sampled among this many of their first elements,
	 * so that each check does a bounded amount of work.
	 * Larger values spread the sampling more evenly,
	 * at a proportional cost.
	 */
	@Default int iterationWindow = 8;

	/**
	 * How many levels of a recursive hint a single check may descend
	 * before accepting whatever lies below.
	 * Bounds the work per check, and makes a check of a value that contains itself terminate.
	 * Explaining a violation ignores this limit.
	 */
	@Default int recursionLimit = 32;
}
