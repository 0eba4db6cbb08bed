package works.vigil.spec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Accepts values {@link Object#equals equal} to one of {@link #values}.
 * Values may include {@code null}.
 */
public record LiteralNode(List<Object> values) implements SpecNode {
	public LiteralNode {
		assert !values.isEmpty(): "Literal must have at least one value";
		values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	public boolean accepts(Object value) {
		return values.contains(value);
	}

	@Override
	public String briefIdentifier() {
		return "Literal" + values.size();
	}

	@Override
	public String toString() {
		return values.stream()
			.map(v -> (v instanceof String) ? "\"" + v + "\"" : String.valueOf(v))
			.collect(joining(", ", "Literal[", "]"));
	}
}
