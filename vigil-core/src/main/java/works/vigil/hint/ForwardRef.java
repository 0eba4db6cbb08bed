package works.vigil.hint;

import static java.util.Objects.requireNonNull;

/**
 * A reference, by name, to a hint that may not exist yet.
 * Resolved against a {@link ForwardScope} when the referring hint is compiled.
 * <p>
 * A plain {@link String} used as a hint means the same thing.
 */
public record ForwardRef(String name) {
	public ForwardRef {
		requireNonNull(name);
		if (name.isBlank()) {
			throw new IllegalArgumentException("Forward reference name must not be blank");
		}
	}

	@Override
	public String toString() {
		return "'" + name + "'";
	}
}
