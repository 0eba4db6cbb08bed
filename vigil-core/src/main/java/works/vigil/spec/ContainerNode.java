package works.vigil.spec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.joining;

/**
 * Accepts instances of {@link #base} whose contents conform to the {@link #children},
 * which are interpreted according to the {@link #arity}.
 * <p>
 * The child count is not validated here; the {@link works.vigil.reduce.Reducer Reducer} does that,
 * so that a malformed node can be reported as such rather than failing at construction.
 */
public record ContainerNode(
	ContainerKind kind,
	Class<?> base,
	Arity arity,
	List<SpecNode> children
) implements SpecNode {
	public ContainerNode {
		children = List.copyOf(children);
	}

	public static ContainerNode sequence(Class<?> base, SpecNode element) {
		assert List.class.isAssignableFrom(base);
		return new ContainerNode(ContainerKind.SEQUENCE, base, Arity.HOMOGENEOUS, List.of(element));
	}

	public static ContainerNode collection(Class<?> base, SpecNode element) {
		assert Iterable.class.isAssignableFrom(base);
		return new ContainerNode(ContainerKind.COLLECTION, base, Arity.HOMOGENEOUS, List.of(element));
	}

	public static ContainerNode array(Class<?> arrayClass, SpecNode element) {
		assert arrayClass.isArray() && !arrayClass.getComponentType().isPrimitive();
		return new ContainerNode(ContainerKind.ARRAY, arrayClass, Arity.HOMOGENEOUS, List.of(element));
	}

	public static ContainerNode mapping(Class<?> base, SpecNode key, SpecNode value) {
		assert Map.class.isAssignableFrom(base);
		return new ContainerNode(ContainerKind.MAPPING, base, Arity.KEY_VALUE, List.of(key, value));
	}

	public static ContainerNode optional(SpecNode content) {
		return new ContainerNode(ContainerKind.OPTIONAL, Optional.class, Arity.HOMOGENEOUS, List.of(content));
	}

	public static ContainerNode tuple(List<SpecNode> positions) {
		return new ContainerNode(ContainerKind.TUPLE, List.class, Arity.fixed(positions.size()), positions);
	}

	/**
	 * Only meaningful for {@link Arity.Homogeneous}.
	 */
	public SpecNode element() {
		return children.get(0);
	}

	/**
	 * Only meaningful for {@link Arity.KeyValue}.
	 */
	public SpecNode key() {
		return children.get(0);
	}

	/**
	 * Only meaningful for {@link Arity.KeyValue}.
	 */
	public SpecNode value() {
		return children.get(1);
	}

	@Override
	public String briefIdentifier() {
		return base.getSimpleName() + "_" + kind;
	}

	@Override
	public String toString() {
		String name = (kind == ContainerKind.TUPLE) ? "Tuple" : base.getSimpleName();
		if (kind == ContainerKind.ARRAY) {
			return children.get(0) + "[]";
		}
		return children.stream()
			.map(Object::toString)
			.collect(joining(", ", name + "<", ">"));
	}
}
