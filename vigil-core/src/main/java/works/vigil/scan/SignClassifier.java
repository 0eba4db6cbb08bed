package works.vigil.scan;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import works.vigil.exceptions.UnsupportedSpecificationException;
import works.vigil.hint.Annotated;
import works.vigil.hint.ForwardRef;
import works.vigil.hint.Literal;
import works.vigil.hint.Sentinel;
import works.vigil.hint.Subscripted;
import works.vigil.hint.Tuple;
import works.vigil.hint.TypeReference;
import works.vigil.hint.Union;

import static java.util.Map.entry;
import static works.vigil.scan.HintSign.ANNOTATED;
import static works.vigil.scan.HintSign.ARRAY;
import static works.vigil.scan.HintSign.ATOMIC;
import static works.vigil.scan.HintSign.CALLABLE;
import static works.vigil.scan.HintSign.COLLECTION;
import static works.vigil.scan.HintSign.FORWARD;
import static works.vigil.scan.HintSign.GENERIC;
import static works.vigil.scan.HintSign.IGNORABLE;
import static works.vigil.scan.HintSign.LITERAL;
import static works.vigil.scan.HintSign.MAPPING;
import static works.vigil.scan.HintSign.NONE;
import static works.vigil.scan.HintSign.NOTHING;
import static works.vigil.scan.HintSign.OPTIONAL;
import static works.vigil.scan.HintSign.PREDICATE;
import static works.vigil.scan.HintSign.SEQUENCE;
import static works.vigil.scan.HintSign.SUBCLASS;
import static works.vigil.scan.HintSign.TUPLE;
import static works.vigil.scan.HintSign.TYPE_VARIABLE;
import static works.vigil.scan.HintSign.UNION;
import static works.vigil.scan.HintSign.WILDCARD;

/**
 * Determines the {@link HintSign} of a raw hint.
 * <p>
 * Rules are tried in order, most specific first:
 *
 * <ol>
 *     <li>builtin sentinels, by identity;</li>
 *     <li>"origin + arguments" shapes, by looking up the origin in {@link #ORIGIN_SIGNS};</li>
 *     <li>reflective type variables and wildcards;</li>
 *     <li>plain classes;</li>
 *     <li>predicates;</li>
 *     <li>forward references.</li>
 * </ol>
 *
 * Each rule's trigger is a distinct Java type, so no hint can satisfy two of them;
 * the order only puts the common cases first.
 * A hint matching no rule is an error, never silently accepted.
 */
public final class SignClassifier {
	private SignClassifier() { }

	/**
	 * Signs of "origin + arguments" hints, keyed by the exact origin class.
	 * Origins that aren't listed here have the sign {@link HintSign#GENERIC}.
	 */
	static final Map<Class<?>, HintSign> ORIGIN_SIGNS = Map.ofEntries(
		entry(Union.class, UNION),
		entry(Literal.class, LITERAL),
		entry(Tuple.class, TUPLE),
		entry(Annotated.class, ANNOTATED),

		entry(List.class, SEQUENCE),
		entry(ArrayList.class, SEQUENCE),
		entry(LinkedList.class, SEQUENCE),
		entry(CopyOnWriteArrayList.class, SEQUENCE),

		entry(Iterable.class, COLLECTION),
		entry(Collection.class, COLLECTION),
		entry(Set.class, COLLECTION),
		entry(SortedSet.class, COLLECTION),
		entry(NavigableSet.class, COLLECTION),
		entry(HashSet.class, COLLECTION),
		entry(LinkedHashSet.class, COLLECTION),
		entry(TreeSet.class, COLLECTION),
		entry(Queue.class, COLLECTION),
		entry(Deque.class, COLLECTION),
		entry(ArrayDeque.class, COLLECTION),

		entry(Map.class, MAPPING),
		entry(SortedMap.class, MAPPING),
		entry(NavigableMap.class, MAPPING),
		entry(HashMap.class, MAPPING),
		entry(LinkedHashMap.class, MAPPING),
		entry(TreeMap.class, MAPPING),
		entry(ConcurrentMap.class, MAPPING),
		entry(ConcurrentHashMap.class, MAPPING),

		entry(Optional.class, OPTIONAL),
		entry(Class.class, SUBCLASS),

		entry(Function.class, CALLABLE),
		entry(BiFunction.class, CALLABLE),
		entry(UnaryOperator.class, CALLABLE),
		entry(BinaryOperator.class, CALLABLE),
		entry(Supplier.class, CALLABLE),
		entry(Consumer.class, CALLABLE),
		entry(BiConsumer.class, CALLABLE),
		entry(Predicate.class, CALLABLE),
		entry(Callable.class, CALLABLE)
	);

	/**
	 * @throws UnsupportedSpecificationException if {@code hint} has no recognizable shape
	 */
	public static HintSign classify(Object hint) {
		if (hint instanceof TypeReference<?> ref) {
			return classify(ref.reflectionType());
		}

		// Rule 1: sentinels
		if (hint == null || hint == Sentinel.NONE || hint == Void.class || hint == void.class) {
			return NONE;
		} else if (hint == Sentinel.ANY || hint == Object.class) {
			return IGNORABLE;
		} else if (hint == Sentinel.NOTHING) {
			return NOTHING;
		}

		// Rule 2: origin + arguments
		if (hint instanceof ParameterizedType pt) {
			return signOfOrigin(pt.getRawType(), hint);
		} else if (hint instanceof Subscripted s) {
			return signOfOrigin(s.origin(), hint);
		} else if (hint instanceof GenericArrayType) {
			return ARRAY;
		}

		// Rule 3: reflective type variables
		if (hint instanceof TypeVariable<?>) {
			return TYPE_VARIABLE;
		} else if (hint instanceof WildcardType) {
			return WILDCARD;
		}

		// Rule 4: plain classes
		if (hint instanceof Class<?> c) {
			// The JVM already guarantees the element type of a primitive array
			return (c.isArray() && !c.getComponentType().isPrimitive()) ? ARRAY : ATOMIC;
		}

		// Rule 5: callables that aren't types
		if (hint instanceof Predicate<?>) {
			return PREDICATE;
		}

		// Rule 6: deferred names
		if (hint instanceof String || hint instanceof ForwardRef) {
			return FORWARD;
		}

		throw UnsupportedSpecificationException.of(hint, "not a recognized hint shape (" + hint.getClass().getName() + ")");
	}

	private static HintSign signOfOrigin(Object origin, Object hint) {
		if (origin instanceof Class<?> c) {
			return ORIGIN_SIGNS.getOrDefault(c, GENERIC);
		} else {
			throw UnsupportedSpecificationException.of(hint, "origin must be a class, not " + origin);
		}
	}

	/**
	 * @return the hint itself, or the type carried by a {@link TypeReference}
	 */
	public static Object unwrap(Object hint) {
		return (hint instanceof TypeReference<?> ref) ? ref.reflectionType() : hint;
	}

	/**
	 * @return the class an "origin + arguments" hint is subscripting
	 */
	public static Class<?> originOf(Object hint) {
		if (hint instanceof ParameterizedType pt) {
			return (Class<?>) pt.getRawType();
		} else if (hint instanceof Subscripted s && s.origin() instanceof Class<?> c) {
			return c;
		} else {
			throw new IllegalArgumentException("Hint has no origin: " + hint);
		}
	}

	/**
	 * @return the arguments of an "origin + arguments" hint
	 */
	public static List<Object> argumentsOf(Object hint) {
		if (hint instanceof ParameterizedType pt) {
			return List.of((Object[]) pt.getActualTypeArguments());
		} else if (hint instanceof Subscripted s) {
			return s.arguments();
		} else {
			throw new IllegalArgumentException("Hint has no arguments: " + hint);
		}
	}

	/**
	 * Java's type erasure: the class that every value of {@code type} is an instance of.
	 * Lower-bounded wildcards erase to {@code Object}, since the values they admit can be
	 * of any supertype of the bound.
	 */
	public static Class<?> erasure(Type type) {
		if (type instanceof Class<?> c) {
			return c;
		} else if (type instanceof ParameterizedType pt) {
			return (Class<?>) pt.getRawType();
		} else if (type instanceof GenericArrayType g) {
			return Array.newInstance(erasure(g.getGenericComponentType()), 0).getClass();
		} else if (type instanceof TypeVariable<?> tv) {
			return erasure(tv.getBounds()[0]);
		} else if (type instanceof WildcardType w) {
			return (w.getLowerBounds().length == 0) ? erasure(w.getUpperBounds()[0]) : Object.class;
		} else {
			throw new IllegalArgumentException("Unsupported type: " + type);
		}
	}
}
