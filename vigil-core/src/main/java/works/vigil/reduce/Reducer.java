package works.vigil.reduce;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.vigil.exceptions.MalformedContainerArityException;
import works.vigil.exceptions.UnresolvedForwardReferenceException;
import works.vigil.exceptions.VigilException;
import works.vigil.hint.ForwardScope;
import works.vigil.scan.SpecScanner;
import works.vigil.spec.AnnotatedNode;
import works.vigil.spec.Arity;
import works.vigil.spec.AtomicNode;
import works.vigil.spec.ContainerNode;
import works.vigil.spec.ForwardNode;
import works.vigil.spec.IgnorableNode;
import works.vigil.spec.LiteralNode;
import works.vigil.spec.PredicateNode;
import works.vigil.spec.RefNode;
import works.vigil.spec.ReducedSpec;
import works.vigil.spec.SpecGraph;
import works.vigil.spec.SpecNode;
import works.vigil.spec.UnionNode;

import static works.vigil.spec.SpecNode.transform;

/**
 * Rewrites a {@link SpecNode} tree into an equivalent canonical one,
 * resolving {@link ForwardNode}s along the way.
 * <p>
 * This is a "simplification" pass: it walks the tree in postorder,
 * looking "downward only" at the node and its already-reduced children at each step.
 * The rewrites are:
 *
 * <ul>
 *     <li>
 *         {@code Object} becomes {@link IgnorableNode}.
 *     </li>
 *     <li>
 *         Nested unions are flattened; a union containing an {@link IgnorableNode} becomes one;
 *         literal alternatives are merged; duplicates are dropped, keeping the first occurrence;
 *         and a union of one alternative becomes that alternative.
 *     </li>
 *     <li>
 *         A variable-length container whose children are all {@link IgnorableNode}
 *         only needs its shallow check, so it becomes an {@link AtomicNode} of its base class.
 *         Fixed-length tuples keep their length check.
 *     </li>
 *     <li>
 *         An annotated node keeps its validators even when its hint reduces to an {@link IgnorableNode}.
 *     </li>
 *     <li>
 *         A forward reference is replaced by its reduced definition,
 *         unless the definition refers back to itself,
 *         in which case it becomes a {@link RefNode} into the {@link SpecGraph}.
 *     </li>
 * </ul>
 *
 * The output contains no {@link ForwardNode}s, no nested unions, and no containers
 * whose children disagree with their {@link Arity}.
 * <p>
 * Each instance performs a single reduction, because the graph it builds is frozen at the end.
 */
public class Reducer {
	final SpecGraph graph = new SpecGraph();
	final Map<SpecNode, SpecNode> memo = new HashMap<>();
	final Map<ForwardKey, Integer> handles = new HashMap<>();
	final Map<Integer, SpecNode> inlinable = new HashMap<>();
	final Set<Integer> recursive = new HashSet<>();
	final Deque<Frame> frames = new ArrayDeque<>();
	int containerDepth = 0;
	int forwardsSeen = 0;
	boolean used = false;

	/**
	 * Forward references are identified by name within a scope.
	 * Scopes use identity equality, so two scopes can define the same name differently.
	 */
	record ForwardKey(ForwardScope scope, String name) { }

	/**
	 * A forward reference whose definition is being reduced.
	 * A reference back to it is acceptable only if a container has been entered since,
	 * because that's what makes each recursive step consume part of the value.
	 */
	record Frame(int handle, String name, int containerDepth) { }

	/**
	 * @throws UnresolvedForwardReferenceException if a forward reference can't be resolved,
	 * or is recursive without an intervening container
	 * @throws MalformedContainerArityException if a container's children disagree with its arity
	 */
	public ReducedSpec reduce(SpecNode root) {
		if (used) {
			throw new IllegalStateException("Reducer has already been used");
		}
		used = true;
		SpecNode result = reduceNode(root);
		graph.freeze();
		LOGGER.debug("Reduced {} to {}", root, result);
		return new ReducedSpec(result, graph);
	}

	SpecNode reduceNode(SpecNode node) {
		SpecNode memoized = memo.get(node);
		if (memoized != null) {
			LOGGER.trace("Reusing {}", node);
			return memoized;
		}
		int forwardsBefore = forwardsSeen;
		LOGGER.trace("Reduce {}", node);
		SpecNode result;
		if (node instanceof IgnorableNode n) {
			result = n;
		} else if (node instanceof AtomicNode n) {
			result = (n.type() == Object.class) ? IgnorableNode.INSTANCE : n;
		} else if (node instanceof LiteralNode n) {
			result = transform(n, x -> new LiteralNode(new ArrayList<>(new LinkedHashSet<>(x.values()))));
		} else if (node instanceof PredicateNode n) {
			result = n;
		} else if (node instanceof RefNode n) {
			result = n;
		} else if (node instanceof AnnotatedNode n) {
			SpecNode hinted = reduceNode(n.hinted());
			result = transform(n, x -> new AnnotatedNode(hinted, x.validators()));
		} else if (node instanceof UnionNode n) {
			result = reduceUnion(n);
		} else if (node instanceof ContainerNode n) {
			result = reduceContainer(n);
		} else if (node instanceof ForwardNode n) {
			forwardsSeen++;
			result = reduceForward(n);
		} else {
			throw new IllegalStateException("Unexpected node type: " + node.getClass());
		}
		// Anything involving a forward reference depends on where it appears,
		// so it can't be reused elsewhere.
		if (forwardsSeen == forwardsBefore) {
			memo.put(node, result);
		}
		return result;
	}

	private SpecNode reduceUnion(UnionNode union) {
		List<SpecNode> flattened = new ArrayList<>();
		for (SpecNode alternative: union.alternatives()) {
			SpecNode reduced = reduceNode(alternative);
			if (reduced instanceof UnionNode u) {
				// Already reduced, hence already flat
				flattened.addAll(u.alternatives());
			} else {
				flattened.add(reduced);
			}
		}

		if (flattened.stream().anyMatch(a -> a instanceof IgnorableNode)) {
			return IgnorableNode.INSTANCE;
		}

		Set<SpecNode> distinct = new LinkedHashSet<>();
		List<Object> literalValues = new ArrayList<>();
		int literalPosition = -1;
		for (SpecNode alternative: flattened) {
			if (alternative instanceof LiteralNode l) {
				if (literalPosition < 0) {
					literalPosition = distinct.size();
				}
				literalValues.addAll(l.values());
			} else if (!alternative.equals(AtomicNode.NOTHING)) {
				distinct.add(alternative);
			}
		}

		List<SpecNode> alternatives = new ArrayList<>(distinct);
		if (literalPosition >= 0) {
			alternatives.add(literalPosition, reduceNode(new LiteralNode(literalValues)));
		}

		return switch (alternatives.size()) {
			case 0 -> AtomicNode.NOTHING;
			case 1 -> alternatives.get(0);
			default -> transform(union, x -> new UnionNode(alternatives));
		};
	}

	private SpecNode reduceContainer(ContainerNode container) {
		Arity arity = container.arity();
		if (!container.kind().isCompatibleWith(arity)) {
			throw new MalformedContainerArityException(container.kind() + " container can't have arity " + arity);
		}
		if (container.children().size() != arity.expectedChildren()) {
			throw new MalformedContainerArityException(
				"Container " + container.briefIdentifier()
					+ " with arity " + arity
					+ " must have " + arity.expectedChildren()
					+ " children; found " + container.children().size());
		}

		List<SpecNode> children = new ArrayList<>(container.children().size());
		containerDepth++;
		try {
			for (SpecNode child: container.children()) {
				children.add(reduceNode(child));
			}
		} finally {
			containerDepth--;
		}

		if (!(arity instanceof Arity.Fixed) && children.stream().allMatch(c -> c instanceof IgnorableNode)) {
			LOGGER.trace("Container {} has only ignorable children; reducing to a shallow check", container.briefIdentifier());
			return new AtomicNode(container.base());
		}
		return transform(container, x -> new ContainerNode(x.kind(), x.base(), x.arity(), children));
	}

	private SpecNode reduceForward(ForwardNode forward) {
		ForwardKey key = new ForwardKey(forward.scope(), forward.name());
		Integer existing = handles.get(key);
		if (existing != null) {
			return referTo(existing, forward.name());
		}

		Object hint = forward.scope().lookup(forward.name())
			.orElseThrow(() -> new UnresolvedForwardReferenceException(
				forward.name(),
				"Forward reference '" + forward.name() + "' names nothing in " + forward.scope()));

		int handle = graph.allocate(forward.name());
		handles.put(key, handle);
		frames.push(new Frame(handle, forward.name(), containerDepth));
		SpecNode definition;
		try {
			definition = reduceNode(new SpecScanner(forward.scope()).scan(hint));
		} catch (VigilException e) {
			throw VigilException.wrap(e, "In forward reference '" + forward.name() + "'");
		} finally {
			frames.pop();
		}
		graph.define(handle, definition);

		if (recursive.contains(handle)) {
			LOGGER.debug("Forward reference '{}' is recursive; defined as @{}", forward.name(), handle);
			return new RefNode(handle);
		} else {
			LOGGER.debug("Inlining forward reference '{}' as {}", forward.name(), definition);
			inlinable.put(handle, definition);
			return definition;
		}
	}

	private SpecNode referTo(int handle, String name) {
		SpecNode inlined = inlinable.get(handle);
		if (inlined != null) {
			return inlined;
		}
		for (Frame frame: frames) {
			if (frame.handle() == handle) {
				if (frame.containerDepth() == containerDepth) {
					throw new UnresolvedForwardReferenceException(name,
						"Forward reference '" + name + "' refers to itself without an intervening container");
				}
				recursive.add(handle);
				return new RefNode(handle);
			}
		}
		// Finished, and recursive
		return new RefNode(handle);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Reducer.class);
}
