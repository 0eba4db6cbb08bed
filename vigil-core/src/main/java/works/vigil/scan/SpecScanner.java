package works.vigil.scan;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.exceptions.UnsupportedSpecificationException;
import works.vigil.exceptions.VigilException;
import works.vigil.hint.ForwardRef;
import works.vigil.hint.ForwardScope;
import works.vigil.hint.Hint;
import works.vigil.spec.AnnotatedNode;
import works.vigil.spec.AtomicNode;
import works.vigil.spec.ContainerNode;
import works.vigil.spec.ForwardNode;
import works.vigil.spec.IgnorableNode;
import works.vigil.spec.LiteralNode;
import works.vigil.spec.PredicateNode;
import works.vigil.spec.SpecNode;
import works.vigil.spec.SubclassOf;
import works.vigil.spec.UnionNode;

import static java.util.Map.entry;

/**
 * Walks a raw hint, classifying each sub-hint with the {@link SignClassifier},
 * to build the corresponding {@link SpecNode} tree.
 * <p>
 * The tree is not yet canonical: it may contain nested or redundant unions,
 * {@link ForwardNode}s, and so on. The {@link works.vigil.reduce.Reducer Reducer} cleans that up.
 * <p>
 * Each instance tracks the type variables it is currently expanding,
 * so that an F-bounded variable like {@code T extends List<T>} terminates;
 * hence, scanners are not thread-safe.
 */
public class SpecScanner {
	final ForwardScope scope;
	final Set<TypeVariable<?>> variablesInProgress = new HashSet<>();

	public SpecScanner(ForwardScope scope) {
		this.scope = scope;
	}

	/**
	 * @throws UnsupportedSpecificationException if {@code hint} or any hint nested within it
	 * has no recognizable shape, or is subscripted by the wrong number of arguments.
	 */
	public SpecNode scan(Object hint) {
		Object h = SignClassifier.unwrap(hint);
		HintSign sign = SignClassifier.classify(h);
		LOGGER.trace("Scan {} with sign {}", Hint.describe(h), sign);
		return switch (sign) {
			case IGNORABLE -> IgnorableNode.INSTANCE;
			case NONE -> AtomicNode.NONE;
			case NOTHING -> AtomicNode.NOTHING;
			case ATOMIC -> new AtomicNode(boxed((Class<?>) h));
			case UNION -> new UnionNode(scanArguments(h, requireAtLeastOne(h)));
			case LITERAL -> new LiteralNode(requireAtLeastOne(h));
			case TUPLE -> ContainerNode.tuple(scanArguments(h, SignClassifier.argumentsOf(h)));
			case SEQUENCE -> scanHomogeneous(h, element -> ContainerNode.sequence(SignClassifier.originOf(h), element));
			case COLLECTION -> scanHomogeneous(h, element -> ContainerNode.collection(SignClassifier.originOf(h), element));
			case OPTIONAL -> scanHomogeneous(h, ContainerNode::optional);
			case ARRAY -> scanArray(h);
			case MAPPING -> scanMapping(h);
			case SUBCLASS -> scanSubclass(h);
			case CALLABLE -> new AtomicNode(SignClassifier.originOf(h));
			case GENERIC -> {
				Class<?> origin = SignClassifier.originOf(h);
				LOGGER.debug("Erasing type arguments of {} to {}", Hint.describe(h), origin.getSimpleName());
				yield new AtomicNode(boxed(origin));
			}
			case TYPE_VARIABLE -> scanTypeVariable((TypeVariable<?>) h);
			case WILDCARD -> scanWildcard((WildcardType) h);
			case PREDICATE -> new PredicateNode(asPredicate(h));
			case ANNOTATED -> scanAnnotated(h);
			case FORWARD -> new ForwardNode(forwardName(h), scope);
		};
	}

	private List<Object> requireAtLeastOne(Object hint) {
		List<Object> args = SignClassifier.argumentsOf(hint);
		if (args.isEmpty()) {
			throw UnsupportedSpecificationException.of(hint, "requires at least one argument");
		}
		return args;
	}

	private List<SpecNode> scanArguments(Object parent, List<Object> arguments) {
		List<SpecNode> result = new ArrayList<>(arguments.size());
		for (Object argument: arguments) {
			result.add(scanNested(parent, argument));
		}
		return result;
	}

	/**
	 * Scans a sub-hint, adding the parent to the message of any exception
	 * so the caller can tell where in a deeply nested hint the problem lies.
	 */
	private SpecNode scanNested(Object parent, Object argument) {
		try {
			return scan(argument);
		} catch (VigilException e) {
			throw VigilException.wrap(e, "In " + Hint.describe(parent));
		}
	}

	private interface HomogeneousFactory {
		ContainerNode create(SpecNode element);
	}

	/**
	 * A container origin subscripted by nothing is just the bare origin class.
	 */
	private SpecNode scanHomogeneous(Object hint, HomogeneousFactory factory) {
		List<Object> args = SignClassifier.argumentsOf(hint);
		return switch (args.size()) {
			case 0 -> new AtomicNode(SignClassifier.originOf(hint));
			case 1 -> factory.create(scanNested(hint, args.get(0)));
			default -> throw UnsupportedSpecificationException.of(hint, "expected 1 argument, got " + args.size());
		};
	}

	private SpecNode scanMapping(Object hint) {
		List<Object> args = SignClassifier.argumentsOf(hint);
		return switch (args.size()) {
			case 0 -> new AtomicNode(SignClassifier.originOf(hint));
			case 2 -> ContainerNode.mapping(
				SignClassifier.originOf(hint),
				scanNested(hint, args.get(0)),
				scanNested(hint, args.get(1)));
			default -> throw UnsupportedSpecificationException.of(hint, "expected 2 arguments, got " + args.size());
		};
	}

	private SpecNode scanArray(Object hint) {
		if (hint instanceof Class<?> c) {
			return ContainerNode.array(c, scanNested(hint, c.getComponentType()));
		} else {
			GenericArrayType g = (GenericArrayType) hint;
			Class<?> arrayClass = SignClassifier.erasure(g);
			return ContainerNode.array(arrayClass, scanNested(hint, g.getGenericComponentType()));
		}
	}

	private SpecNode scanSubclass(Object hint) {
		List<Object> args = SignClassifier.argumentsOf(hint);
		return switch (args.size()) {
			case 0 -> new AtomicNode(Class.class);
			case 1 -> {
				Object bound = SignClassifier.unwrap(args.get(0));
				if (bound instanceof Type t) {
					Class<?> erased = SignClassifier.erasure(t);
					yield (erased == Object.class)
						? new AtomicNode(Class.class)
						: new PredicateNode(new SubclassOf(erased));
				} else {
					throw UnsupportedSpecificationException.of(hint, "bound must be a type, not " + Hint.describe(bound));
				}
			}
			default -> throw UnsupportedSpecificationException.of(hint, "expected 1 argument, got " + args.size());
		};
	}

	/**
	 * A type variable stands for its leftmost bound. If a variable's bound mentions the variable itself,
	 * the inner occurrence accepts anything, since it can't be checked without the actual type argument.
	 */
	private SpecNode scanTypeVariable(TypeVariable<?> variable) {
		Type[] bounds = variable.getBounds();
		if (bounds.length > 1) {
			LOGGER.debug("Type variable {} has bounds {}; only the first is checked", variable, Arrays.toString(bounds));
		}
		if (variablesInProgress.add(variable)) {
			try {
				return scanNested(variable, bounds[0]);
			} finally {
				variablesInProgress.remove(variable);
			}
		} else {
			LOGGER.debug("Type variable {} is recursive; treating inner occurrence as ignorable", variable);
			return IgnorableNode.INSTANCE;
		}
	}

	/**
	 * A lower-bounded wildcard admits values of unknown supertypes, so it can't reject anything.
	 */
	private SpecNode scanWildcard(WildcardType wildcard) {
		if (wildcard.getLowerBounds().length != 0) {
			return IgnorableNode.INSTANCE;
		} else {
			return scanNested(wildcard, wildcard.getUpperBounds()[0]);
		}
	}

	/**
	 * The first argument is the hint; the rest are validators, which must be predicates.
	 */
	private SpecNode scanAnnotated(Object hint) {
		List<Object> args = SignClassifier.argumentsOf(hint);
		if (args.size() < 2) {
			throw UnsupportedSpecificationException.of(hint, "requires a hint and at least one validator");
		}
		List<Predicate<Object>> validators = new ArrayList<>(args.size() - 1);
		for (Object validator: args.subList(1, args.size())) {
			if (validator instanceof Predicate<?>) {
				validators.add(asPredicate(validator));
			} else {
				throw UnsupportedSpecificationException.of(hint, "validator must be a Predicate, not " + Hint.describe(validator));
			}
		}
		return new AnnotatedNode(scanNested(hint, args.get(0)), validators);
	}

	@SuppressWarnings("unchecked")
	private static Predicate<Object> asPredicate(Object hint) {
		return (Predicate<Object>) hint;
	}

	private static String forwardName(Object hint) {
		if (hint instanceof ForwardRef f) {
			return f.name();
		}
		String name = (String) hint;
		if (name.isBlank()) {
			throw UnsupportedSpecificationException.of(hint, "forward reference name must not be blank");
		}
		return name;
	}

	static Class<?> boxed(Class<?> type) {
		return BOXES.getOrDefault(type, type);
	}

	private static final Map<Class<?>, Class<?>> BOXES = Map.ofEntries(
		entry(boolean.class, Boolean.class),
		entry(byte.class, Byte.class),
		entry(short.class, Short.class),
		entry(char.class, Character.class),
		entry(int.class, Integer.class),
		entry(long.class, Long.class),
		entry(float.class, Float.class),
		entry(double.class, Double.class)
	);

	private static final Logger LOGGER = LoggerFactory.getLogger(SpecScanner.class);
}
