package works.vigil.check;

/**
 * The synthesized form of a specification: decides whether a value conforms.
 * <p>
 * Implementations never throw for a non-conforming value,
 * though a caller-supplied predicate's own exceptions propagate.
 */
@FunctionalInterface
public interface Checker {
	boolean check(Object value);

	Checker ACCEPT_ALL = value -> true;
	Checker REJECT_ALL = value -> false;
}
