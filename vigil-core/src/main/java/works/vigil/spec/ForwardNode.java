package works.vigil.spec;

import works.vigil.hint.ForwardScope;

/**
 * A reference to a hint by {@link #name}, not yet resolved in its {@link #scope}.
 * <p>
 * This is a transient node:
 * the {@link works.vigil.reduce.Reducer Reducer} replaces every one of these
 * with the resolved specification, or with a {@link RefNode} if it's recursive.
 */
public record ForwardNode(String name, ForwardScope scope) implements SpecNode {
	@Override
	public String briefIdentifier() {
		return "Fwd_" + name;
	}

	@Override
	public String toString() {
		return "'" + name + "'";
	}
}
