package works.vigil.spec;

/**
 * Determines how a {@link ContainerNode}'s contents are reached,
 * and therefore how they can be sampled.
 */
public enum ContainerKind {
	/**
	 * A {@link java.util.List}, sampled by random index when it's {@link java.util.RandomAccess}.
	 */
	SEQUENCE,

	/**
	 * Any other {@link Iterable}, sampled by bounded iteration.
	 */
	COLLECTION,

	/**
	 * A Java array of references.
	 */
	ARRAY,

	/**
	 * A {@link java.util.Map}; both a key and its value are checked.
	 */
	MAPPING,

	/**
	 * A {@link java.util.Optional}; the value is checked when present.
	 */
	OPTIONAL,

	/**
	 * A fixed-size {@link java.util.List} with a separate specification for each position.
	 */
	TUPLE;

	public boolean isCompatibleWith(Arity arity) {
		return switch (this) {
			case TUPLE -> arity instanceof Arity.Fixed;
			case MAPPING -> arity instanceof Arity.KeyValue;
			case SEQUENCE, COLLECTION, ARRAY, OPTIONAL -> arity instanceof Arity.Homogeneous;
		};
	}
}
