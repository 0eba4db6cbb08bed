package works.vigil.report;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.spec.AnnotatedNode;
import works.vigil.spec.AtomicNode;
import works.vigil.spec.ContainerKind;
import works.vigil.spec.ContainerNode;
import works.vigil.spec.ForwardNode;
import works.vigil.spec.IgnorableNode;
import works.vigil.spec.LiteralNode;
import works.vigil.spec.PredicateNode;
import works.vigil.spec.RefNode;
import works.vigil.spec.ReducedSpec;
import works.vigil.spec.SpecNode;
import works.vigil.spec.UnionNode;

import static java.util.Collections.newSetFromMap;

/**
 * Finds where a value violates a specification, by examining the whole value.
 * <p>
 * This is the slow path, meant to be called only after a {@link works.vigil.check.Checker Checker}
 * has already rejected the value. It visits every part of the value in order and
 * reports the first failure, so its result is deterministic.
 * <p>
 * Unions are the tricky part: when no alternative accepts a value,
 * it isn't obvious which alternative the value was "meant" to match.
 * If exactly one alternative passes its shallow check (for a container, being the right kind of container),
 * the report describes what's wrong inside that alternative;
 * otherwise, it blames the union as a whole.
 * <p>
 * The value may contain cycles. A (node, value) pair that's already being examined
 * further up is assumed to conform, since any violation within it will be found
 * by the outer examination.
 */
public final class ViolationReporter {
	final ReducedSpec spec;
	final List<PathStep> path = new ArrayList<>();
	final Map<SpecNode, Set<Object>> inProgress = new IdentityHashMap<>();

	private ViolationReporter(ReducedSpec spec) {
		this.spec = spec;
	}

	/**
	 * @return the first violation found, or {@link Diagnostic#NONE} if {@code value} conforms
	 */
	public static Diagnostic explain(ReducedSpec spec, Object value) {
		Diagnostic result = new ViolationReporter(spec).visit(spec.root(), value);
		if (result == null) {
			return Diagnostic.NONE;
		} else {
			LOGGER.debug("Violation: {}", result);
			return result;
		}
	}

	/**
	 * @return null if {@code value} conforms to {@code node}
	 */
	private Diagnostic visit(SpecNode node, Object value) {
		if (node instanceof IgnorableNode) {
			return null;
		} else if (node instanceof AtomicNode n) {
			return n.accepts(value) ? null : violation(n, value,
				n.acceptsOnlyNull() ? "not null" : "not an instance of " + n.type().getName());
		} else if (node instanceof LiteralNode n) {
			return n.accepts(value) ? null : violation(n, value, "not one of the literal values");
		} else if (node instanceof PredicateNode n) {
			return n.predicate().test(value) ? null : violation(n, value, "rejected by predicate");
		} else if (node instanceof AnnotatedNode n) {
			return visitAnnotated(n, value);
		} else if (node instanceof UnionNode n) {
			return visitUnion(n, value);
		} else if (node instanceof ContainerNode n) {
			return guarded(n, value);
		} else if (node instanceof RefNode n) {
			return visit(spec.resolve(n), value);
		} else if (node instanceof ForwardNode n) {
			throw new IllegalStateException("Unresolved forward reference in reduced specification: " + n);
		} else {
			throw new IllegalStateException("Unexpected node type: " + node.getClass());
		}
	}

	private Diagnostic visitUnion(UnionNode union, Object value) {
		SpecNode candidate = null;
		int candidates = 0;
		for (SpecNode alternative: union.alternatives()) {
			// Each alternative starts from the same path
			int depth = path.size();
			Diagnostic d = visit(alternative, value);
			assert path.size() == depth;
			if (d == null) {
				return null;
			}
			if (passesShallow(alternative, value)) {
				candidate = alternative;
				candidates++;
			}
		}
		if (candidates == 1) {
			return visit(candidate, value);
		} else if (union.alternatives().isEmpty()) {
			return violation(union, value, "nothing is acceptable");
		} else {
			return violation(union, value, "matches none of the " + union.alternatives().size() + " alternatives");
		}
	}

	/**
	 * A violation inside the hinted part is reported as such;
	 * otherwise, the first validator to reject the value is blamed, at the same path.
	 */
	private Diagnostic visitAnnotated(AnnotatedNode node, Object value) {
		Diagnostic d = visit(node.hinted(), value);
		if (d != null) {
			return d;
		}
		List<Predicate<Object>> validators = node.validators();
		for (int i = 0; i < validators.size(); i++) {
			if (!validators.get(i).test(value)) {
				return violation(node, value, "rejected by validator " + (i + 1) + " of " + validators.size());
			}
		}
		return null;
	}

	/**
	 * Containers are where cycles in the value can be entered, so that's where we guard.
	 */
	private Diagnostic guarded(ContainerNode node, Object value) {
		Set<Object> values = inProgress.computeIfAbsent(node, n -> newSetFromMap(new IdentityHashMap<>()));
		if (value != null && !values.add(value)) {
			LOGGER.trace("Already examining {} against {}", node.briefIdentifier(), System.identityHashCode(value));
			return null;
		}
		try {
			return visitContainer(node, value);
		} finally {
			values.remove(value);
		}
	}

	private Diagnostic visitContainer(ContainerNode node, Object value) {
		if (!passesShallow(node, value)) {
			if (node.kind() == ContainerKind.TUPLE && value instanceof List<?> l) {
				return violation(node, value, "expected " + node.children().size() + " elements, got " + l.size());
			}
			return violation(node, value, "not an instance of " + node.base().getName());
		}
		switch (node.kind()) {
			case SEQUENCE, COLLECTION -> {
				int i = 0;
				for (Object element: (Iterable<?>) value) {
					Diagnostic d = visitStep(new PathStep.Index(i++), node.element(), element);
					if (d != null) {
						return d;
					}
				}
				return null;
			}
			case ARRAY -> {
				Object[] array = (Object[]) value;
				for (int i = 0; i < array.length; i++) {
					Diagnostic d = visitStep(new PathStep.Index(i), node.element(), array[i]);
					if (d != null) {
						return d;
					}
				}
				return null;
			}
			case MAPPING -> {
				for (Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet()) {
					Diagnostic d = visitStep(new PathStep.MapKey(entry.getKey()), node.key(), entry.getKey());
					if (d == null) {
						d = visitStep(new PathStep.MapValue(entry.getKey()), node.value(), entry.getValue());
					}
					if (d != null) {
						return d;
					}
				}
				return null;
			}
			case OPTIONAL -> {
				Optional<?> optional = (Optional<?>) value;
				return optional.isPresent()
					? visitStep(new PathStep.OptionalValue(), node.element(), optional.get())
					: null;
			}
			case TUPLE -> {
				List<?> list = (List<?>) value;
				for (int i = 0; i < node.children().size(); i++) {
					Diagnostic d = visitStep(new PathStep.Index(i), node.children().get(i), list.get(i));
					if (d != null) {
						return d;
					}
				}
				return null;
			}
		}
		throw new IllegalStateException("Unexpected container kind: " + node.kind());
	}

	private Diagnostic visitStep(PathStep step, SpecNode child, Object value) {
		path.add(step);
		try {
			return visit(child, value);
		} finally {
			path.remove(path.size() - 1);
		}
	}

	/**
	 * @return whether {@code value} could plausibly be meant to match {@code node},
	 * judging only by the outermost layer of the value
	 */
	private boolean passesShallow(SpecNode node, Object value) {
		if (node instanceof ContainerNode n) {
			if (n.kind() == ContainerKind.TUPLE) {
				return value instanceof List<?> l && l.size() == n.children().size();
			} else {
				return n.base().isInstance(value);
			}
		} else if (node instanceof RefNode n) {
			return passesShallow(spec.resolve(n), value);
		} else if (node instanceof AnnotatedNode n) {
			// Conforming to the hint but failing a validator is a near miss
			return passesShallow(n.hinted(), value) || visit(n.hinted(), value) == null;
		} else if (node instanceof UnionNode n) {
			return n.alternatives().stream().anyMatch(a -> passesShallow(a, value));
		} else {
			// Leaves have no depth, so their shallow check is the whole check,
			// and visit has already established it fails
			return false;
		}
	}

	private Diagnostic violation(SpecNode node, Object value, String reason) {
		return new Diagnostic(path, node, value, reason);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ViolationReporter.class);
}
