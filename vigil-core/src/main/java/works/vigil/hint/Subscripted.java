package works.vigil.hint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The "origin + arguments" hint shape:
 * an {@code origin} (a class such as {@link java.util.List}, or a marker like {@link Union})
 * subscripted by a list of argument hints.
 * <p>
 * This is the non-reflective counterpart of {@link java.lang.reflect.ParameterizedType},
 * and the only way to express hints that Java's type system can't,
 * such as unions and literals.
 * <p>
 * Arguments may be {@code null}, since literal values may be.
 * Equality is structural, but hints are always cached by identity,
 * so two equal {@code Subscripted} objects are still compiled separately.
 */
public record Subscripted(Object origin, List<Object> arguments) {
	public Subscripted {
		requireNonNull(origin);
		arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	@Override
	public String toString() {
		String name = (origin instanceof Class<?> c) ? c.getSimpleName() : String.valueOf(origin);
		return name + arguments.stream()
			.map(Hint::describe)
			.collect(joining(", ", "[", "]"));
	}
}
