package works.vigil.spec;

import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A node in the specification tree, describing which values are acceptable
 * at some position of a nested hint.
 * <p>
 * Nodes are immutable records, so a tree can't contain cycles directly.
 * Recursive specifications are expressed with {@link RefNode}, which refers
 * to a definition held in a {@link SpecGraph} by its integer handle.
 * <p>
 * The {@link Object#toString() toString} method of each node returns
 * a compact human-readable representation suitable for log messages and diagnostics.
 */
public sealed interface SpecNode permits
	IgnorableNode,
	AtomicNode,
	UnionNode,
	ContainerNode,
	LiteralNode,
	PredicateNode,
	AnnotatedNode,
	ForwardNode,
	RefNode
{
	/**
	 * @return a short string suitable for identifying the node in a log message.
	 * There are no uniqueness requirements; it's only a troubleshooting hint.
	 */
	String briefIdentifier();

	/**
	 * Helper to produce a modified node of the same type as a given
	 * node but with different field values.
	 * <p>
	 * Note: this method is static to enable generics to express the fact
	 * that the returned value has the same type as the original.
	 *
	 * @return <code>transformation.apply(original)</code>,
	 * unless the result is equal to {@code original},
	 * in which case {@code original} is returned.
	 */
	static <N extends SpecNode> N transform(N original, UnaryOperator<N> transformation) {
		N candidate = transformation.apply(requireNonNull(original));
		if (original.equals(candidate)) {
			return original;
		} else {
			return candidate;
		}
	}
}
