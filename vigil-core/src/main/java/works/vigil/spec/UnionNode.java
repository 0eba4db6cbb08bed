package works.vigil.spec;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Accepts any value that at least one of the {@link #alternatives} accepts.
 * With no alternatives, accepts nothing.
 * <p>
 * The order of alternatives has no semantic significance.
 */
public record UnionNode(List<SpecNode> alternatives) implements SpecNode {
	public UnionNode {
		alternatives = List.copyOf(alternatives);
	}

	public static UnionNode of(SpecNode... alternatives) {
		return new UnionNode(List.of(alternatives));
	}

	@Override
	public String briefIdentifier() {
		return "Union" + alternatives.size();
	}

	@Override
	public String toString() {
		return alternatives.stream()
			.map(Object::toString)
			.collect(joining(" | ", "(", ")"));
	}
}
