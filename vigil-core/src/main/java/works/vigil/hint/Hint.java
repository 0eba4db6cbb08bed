package works.vigil.hint;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Factory methods for hints that Java's own type syntax can't express.
 * <p>
 * Any {@link Class}, any reflective {@link Type}, a {@link TypeReference},
 * a {@link Predicate}, or a {@link String} naming a forward reference
 * is already a hint; this class covers the rest.
 */
public final class Hint {
	public static final Sentinel ANY = Sentinel.ANY;
	public static final Sentinel NONE = Sentinel.NONE;
	public static final Sentinel NOTHING = Sentinel.NOTHING;

	private Hint() { }

	/**
	 * @return a hint for {@code origin} subscripted by {@code arguments},
	 * such as {@code Hint.of(Map.class, String.class, Integer.class)}
	 */
	public static Subscripted of(Object origin, Object... arguments) {
		return new Subscripted(origin, Arrays.asList(arguments));
	}

	/**
	 * @return a hint accepting any value accepted by at least one of the {@code alternatives}
	 */
	public static Subscripted union(Object... alternatives) {
		return of(Union.class, alternatives);
	}

	/**
	 * @return a hint accepting {@code null} and whatever {@code hint} accepts
	 */
	public static Subscripted optional(Object hint) {
		return union(hint, NONE);
	}

	/**
	 * @return a hint accepting only values {@link Object#equals equal} to one of {@code values}
	 */
	public static Subscripted literal(Object... values) {
		return of(Literal.class, values);
	}

	/**
	 * @return a hint accepting a {@link java.util.List} of exactly {@code elements.length}
	 * entries, where each entry conforms to the corresponding element hint
	 */
	public static Subscripted tuple(Object... elements) {
		return of(Tuple.class, elements);
	}

	/**
	 * @return a hint accepting values that conform to {@code hint}
	 * and that every one of the {@code validators} approves.
	 * The validators run only on values that already conform to {@code hint}.
	 */
	@SafeVarargs
	public static Subscripted annotated(Object hint, Predicate<Object>... validators) {
		Object[] arguments = new Object[validators.length + 1];
		arguments[0] = hint;
		System.arraycopy(validators, 0, arguments, 1, validators.length);
		return of(Annotated.class, arguments);
	}

	public static ForwardRef forward(String name) {
		return new ForwardRef(name);
	}

	/**
	 * Convenience that gives a lambda the {@code Predicate<Object>} type
	 * the classifier looks for.
	 */
	public static Predicate<Object> is(Predicate<Object> predicate) {
		return requireNonNull(predicate);
	}

	/**
	 * @return a short human-readable rendering of a hint, for messages and logs
	 */
	public static String describe(Object hint) {
		if (hint == null) {
			return "null";
		} else if (hint instanceof Class<?> c) {
			return c.isArray() ? c.getComponentType().getSimpleName() + "[]" : c.getSimpleName();
		} else if (hint instanceof Type t) {
			return t.getTypeName();
		} else if (hint instanceof String s) {
			return "'" + s + "'";
		} else if (hint instanceof Predicate<?>) {
			return "Predicate@" + Integer.toHexString(System.identityHashCode(hint));
		} else {
			return String.valueOf(hint);
		}
	}
}
