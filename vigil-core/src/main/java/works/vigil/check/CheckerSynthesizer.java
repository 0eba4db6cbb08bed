package works.vigil.check;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.exceptions.MalformedContainerArityException;
import works.vigil.exceptions.UnresolvedForwardReferenceException;
import works.vigil.spec.AnnotatedNode;
import works.vigil.spec.AtomicNode;
import works.vigil.spec.ContainerNode;
import works.vigil.spec.ForwardNode;
import works.vigil.spec.IgnorableNode;
import works.vigil.spec.LiteralNode;
import works.vigil.spec.Nothing;
import works.vigil.spec.PredicateNode;
import works.vigil.spec.RefNode;
import works.vigil.spec.ReducedSpec;
import works.vigil.spec.SpecNode;
import works.vigil.spec.UnionNode;

import static java.util.Comparator.comparingInt;

/**
 * Turns a {@link ReducedSpec} into a {@link Checker}: a tree of small closures,
 * one per node, each of which does a constant amount of work per call
 * under the {@link Strategy#SAMPLING SAMPLING} strategy.
 * <p>
 * Containers are checked in two stages:
 * a shallow stage that checks the container itself,
 * and, if that passes, a deep stage that checks one element
 * chosen by the {@link IndexSampler}.
 * Where elements can be reached only by iteration,
 * the element is chosen among the first {@link #iterationWindow} of them.
 * Empty containers pass the deep stage vacuously.
 * <p>
 * Each {@link RefNode} handle is synthesized once and stored in a slot;
 * references encountered while that handle is still being synthesized
 * read the slot lazily at check time, which is how cycles are closed.
 * Every cycle passes through one of these lazy references, so they also count
 * how deeply the current thread has recursed; past {@link #recursionLimit},
 * a lazy reference accepts without looking further.
 * This keeps each check bounded even when the value is deeply nested or contains itself.
 * <p>
 * Each instance performs a single synthesis.
 */
public class CheckerSynthesizer {
	final ReducedSpec spec;
	final Strategy strategy;
	final IndexSampler sampler;
	final int iterationWindow;
	final int recursionLimit;
	final Checker[] slots;
	final boolean[] inProgress;
	final ThreadLocal<int[]> recursionDepth = ThreadLocal.withInitial(() -> new int[1]);

	public CheckerSynthesizer(ReducedSpec spec, Strategy strategy, IndexSampler sampler, int iterationWindow, int recursionLimit) {
		if (iterationWindow < 1) {
			throw new IllegalArgumentException("iterationWindow must be positive: " + iterationWindow);
		}
		if (recursionLimit < 1) {
			throw new IllegalArgumentException("recursionLimit must be positive: " + recursionLimit);
		}
		this.spec = spec;
		this.strategy = strategy;
		this.sampler = sampler;
		this.iterationWindow = iterationWindow;
		this.recursionLimit = recursionLimit;
		this.slots = new Checker[spec.graph().size()];
		this.inProgress = new boolean[spec.graph().size()];
	}

	public Checker synthesize() {
		if (strategy == Strategy.DISABLED) {
			LOGGER.debug("Checking disabled for {}", spec);
			return Checker.ACCEPT_ALL;
		}
		return checkerFor(spec.root());
	}

	Checker checkerFor(SpecNode node) {
		if (node instanceof IgnorableNode) {
			return Checker.ACCEPT_ALL;
		} else if (node instanceof AtomicNode n) {
			return atomic(n);
		} else if (node instanceof LiteralNode n) {
			return literal(n);
		} else if (node instanceof PredicateNode n) {
			return n.predicate()::test;
		} else if (node instanceof AnnotatedNode n) {
			return annotated(n);
		} else if (node instanceof UnionNode n) {
			return union(n);
		} else if (node instanceof ContainerNode n) {
			return container(n);
		} else if (node instanceof RefNode n) {
			return ref(n);
		} else if (node instanceof ForwardNode n) {
			throw new UnresolvedForwardReferenceException(n.name(),
				"Forward reference '" + n.name() + "' was not resolved before synthesis");
		} else {
			throw new IllegalStateException("Unexpected node type: " + node.getClass());
		}
	}

	private static Checker atomic(AtomicNode node) {
		if (node.acceptsOnlyNull()) {
			return Objects::isNull;
		} else if (node.type() == Nothing.class) {
			return Checker.REJECT_ALL;
		} else {
			Class<?> type = node.type();
			return type::isInstance;
		}
	}

	private static Checker literal(LiteralNode node) {
		if (node.values().size() == 1) {
			Object expected = node.values().get(0);
			return value -> Objects.equals(expected, value);
		} else {
			Set<Object> expected = new HashSet<>(node.values());
			return expected::contains;
		}
	}

	/**
	 * Alternatives are tried cheapest first. The order has no effect on the result,
	 * since alternatives have no side effects other than those of caller-supplied predicates.
	 */
	private Checker union(UnionNode node) {
		if (node.alternatives().isEmpty()) {
			return Checker.REJECT_ALL;
		}
		List<SpecNode> ordered = new ArrayList<>(node.alternatives());
		ordered.sort(comparingInt(CheckerSynthesizer::costTier)); // Stable
		Checker[] alternatives = new Checker[ordered.size()];
		for (int i = 0; i < alternatives.length; i++) {
			alternatives[i] = checkerFor(ordered.get(i));
		}
		if (alternatives.length == 2) {
			Checker first = alternatives[0];
			Checker second = alternatives[1];
			return value -> first.check(value) || second.check(value);
		}
		return value -> {
			for (Checker alternative: alternatives) {
				if (alternative.check(value)) {
					return true;
				}
			}
			return false;
		};
	}

	@SuppressWarnings("unchecked")
	private Checker annotated(AnnotatedNode node) {
		Checker hinted = checkerFor(node.hinted());
		Predicate<Object>[] validators = node.validators().toArray(new Predicate[0]);
		return value -> {
			if (!hinted.check(value)) {
				return false;
			}
			for (Predicate<Object> validator: validators) {
				if (!validator.test(value)) {
					return false;
				}
			}
			return true;
		};
	}

	static int costTier(SpecNode node) {
		if (node instanceof ContainerNode || node instanceof RefNode || node instanceof UnionNode) {
			return 1;
		} else if (node instanceof PredicateNode || node instanceof AnnotatedNode) {
			return 2;
		} else {
			return 0;
		}
	}

	private Checker ref(RefNode node) {
		int handle = node.handle();
		Checker existing = slots[handle];
		if (existing != null) {
			return existing;
		}
		if (inProgress[handle]) {
			LOGGER.trace("Lazy indirection for {}", node);
			return value -> recurse(handle, value);
		}
		inProgress[handle] = true;
		Checker result = checkerFor(spec.graph().get(handle));
		slots[handle] = result;
		inProgress[handle] = false;
		return result;
	}

	private boolean recurse(int handle, Object value) {
		int[] depth = recursionDepth.get();
		if (depth[0] >= recursionLimit) {
			return true;
		}
		depth[0]++;
		try {
			// Filled in before synthesize returns, and hence before any call
			return slots[handle].check(value);
		} finally {
			depth[0]--;
		}
	}

	private Checker container(ContainerNode node) {
		if (node.children().size() != node.arity().expectedChildren()) {
			throw new MalformedContainerArityException("Container " + node.briefIdentifier() + " has " + node.children().size() + " children");
		}
		return switch (node.kind()) {
			case SEQUENCE -> sequence(node.base(), checkerFor(node.element()));
			case COLLECTION -> collection(node.base(), checkerFor(node.element()));
			case ARRAY -> array(node.base(), checkerFor(node.element()));
			case MAPPING -> mapping(node.base(), checkerFor(node.key()), checkerFor(node.value()));
			case OPTIONAL -> optional(checkerFor(node.element()));
			case TUPLE -> tuple(node);
		};
	}

	private Checker sequence(Class<?> base, Checker element) {
		if (strategy == Strategy.EXHAUSTIVE) {
			return collection(base, element);
		}
		return value -> {
			if (!base.isInstance(value)) {
				return false;
			}
			List<?> list = (List<?>) value;
			if (list.isEmpty()) {
				return true;
			} else if (list instanceof RandomAccess) {
				return element.check(list.get(sampler.nextIndex(list.size())));
			} else {
				return element.check(sampleByIteration(list.iterator(), list.size()));
			}
		};
	}

	private Checker collection(Class<?> base, Checker element) {
		if (strategy == Strategy.EXHAUSTIVE) {
			return value -> {
				if (!base.isInstance(value)) {
					return false;
				}
				for (Object e: (Iterable<?>) value) {
					if (!element.check(e)) {
						return false;
					}
				}
				return true;
			};
		}
		return value -> {
			if (!base.isInstance(value)) {
				return false;
			}
			if (value instanceof Collection<?> c) {
				return c.isEmpty() || element.check(sampleByIteration(c.iterator(), c.size()));
			}
			// Size unknown: buffer the window
			Iterator<?> iterator = ((Iterable<?>) value).iterator();
			Object[] window = new Object[iterationWindow];
			int count = 0;
			while (count < iterationWindow && iterator.hasNext()) {
				window[count++] = iterator.next();
			}
			return count == 0 || element.check(window[sampler.nextIndex(count)]);
		};
	}

	private Checker array(Class<?> base, Checker element) {
		if (strategy == Strategy.EXHAUSTIVE) {
			return value -> {
				if (!base.isInstance(value)) {
					return false;
				}
				for (Object e: (Object[]) value) {
					if (!element.check(e)) {
						return false;
					}
				}
				return true;
			};
		}
		return value -> {
			if (!base.isInstance(value)) {
				return false;
			}
			Object[] array = (Object[]) value;
			return array.length == 0 || element.check(array[sampler.nextIndex(array.length)]);
		};
	}

	private Checker mapping(Class<?> base, Checker key, Checker val) {
		if (strategy == Strategy.EXHAUSTIVE) {
			return value -> {
				if (!base.isInstance(value)) {
					return false;
				}
				for (Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
					if (!key.check(entry.getKey()) || !val.check(entry.getValue())) {
						return false;
					}
				}
				return true;
			};
		}
		return value -> {
			if (!base.isInstance(value)) {
				return false;
			}
			Map<?, ?> map = (Map<?, ?>) value;
			if (map.isEmpty()) {
				return true;
			}
			Map.Entry<?, ?> entry = (Map.Entry<?, ?>) sampleByIteration(map.entrySet().iterator(), map.size());
			return key.check(entry.getKey()) && val.check(entry.getValue());
		};
	}

	private static Checker optional(Checker content) {
		return value -> value instanceof Optional<?> o
			&& (o.isEmpty() || content.check(o.get()));
	}

	private Checker tuple(ContainerNode node) {
		int length = node.arity().expectedChildren();
		Checker[] positions = new Checker[length];
		boolean deep = false;
		for (int i = 0; i < length; i++) {
			SpecNode child = node.children().get(i);
			positions[i] = checkerFor(child);
			deep |= !(child instanceof IgnorableNode);
		}
		if (!deep) {
			return value -> value instanceof List<?> l && l.size() == length;
		} else if (strategy == Strategy.EXHAUSTIVE) {
			return value -> {
				if (!(value instanceof List<?> l) || l.size() != length) {
					return false;
				}
				for (int i = 0; i < length; i++) {
					if (!positions[i].check(l.get(i))) {
						return false;
					}
				}
				return true;
			};
		} else {
			return value -> {
				if (!(value instanceof List<?> l) || l.size() != length) {
					return false;
				}
				int i = sampler.nextIndex(length);
				return positions[i].check(l.get(i));
			};
		}
	}

	/**
	 * @param size of the collection being iterated; strictly positive
	 * @return an element chosen among the first {@link #iterationWindow} (or fewer) elements
	 */
	private Object sampleByIteration(Iterator<?> iterator, int size) {
		int target = sampler.nextIndex(Math.min(size, iterationWindow));
		for (int i = 0; i < target; i++) {
			iterator.next();
		}
		return iterator.next();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CheckerSynthesizer.class);
}
