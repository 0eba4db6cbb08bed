package works.vigil.scan;

/**
 * The canonical category of a raw hint, as determined by {@link SignClassifier}.
 * <p>
 * This is a closed set: every hint the classifier accepts has exactly one sign,
 * and {@link SpecScanner} has exactly one way of turning each sign into a
 * {@link works.vigil.spec.SpecNode}.
 */
public enum HintSign {
	/** Accepts anything: {@link works.vigil.hint.Sentinel#ANY} or {@code Object}. */
	IGNORABLE,

	/** Accepts only {@code null}. */
	NONE,

	/** Accepts nothing. */
	NOTHING,

	/** A plain class, checked with {@code instanceof}. */
	ATOMIC,

	/** One of several alternatives. */
	UNION,

	/** One of a fixed set of values. */
	LITERAL,

	/** A fixed-size list with a hint per position. */
	TUPLE,

	/** A list with a hint for its elements. */
	SEQUENCE,

	/** Any other iterable with a hint for its elements. */
	COLLECTION,

	/** An array of references with a hint for its elements. */
	ARRAY,

	/** A map with hints for its keys and values. */
	MAPPING,

	/** An {@link java.util.Optional} with a hint for its content. */
	OPTIONAL,

	/** A {@code Class<? extends X>}, accepting class objects for subtypes of {@code X}. */
	SUBCLASS,

	/**
	 * A functional interface subscripted by its parameter and return types.
	 * Only the interface itself can be checked at run time.
	 */
	CALLABLE,

	/**
	 * Any other parameterized class. Type arguments are erased,
	 * since they are not observable on the value.
	 */
	GENERIC,

	/** A reflective type variable, standing for its leftmost bound. */
	TYPE_VARIABLE,

	/** A reflective wildcard, standing for its upper bound. */
	WILDCARD,

	/** A caller-supplied {@link java.util.function.Predicate}. */
	PREDICATE,

	/** A hint followed by validator predicates that conforming values must also satisfy. */
	ANNOTATED,

	/** A {@link works.vigil.hint.ForwardRef} or a {@link String} naming one. */
	FORWARD
}
