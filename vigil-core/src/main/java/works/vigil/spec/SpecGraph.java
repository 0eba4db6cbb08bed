package works.vigil.spec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The arena holding named, possibly recursive, definitions referred to by {@link RefNode}s.
 * Each definition lives in a slot identified by an integer handle.
 * <p>
 * A slot is {@link #allocate allocated} before its definition is known,
 * so that references to it can be created while the definition is still being built;
 * that's how cycles are closed.
 * <p>
 * Once {@link #freeze frozen}, can be considered immutable.
 */
public final class SpecGraph {
	private final List<String> names = new ArrayList<>();
	private final List<SpecNode> definitions = new ArrayList<>();
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	/**
	 * @param name has no significance other than for troubleshooting
	 * @return the handle of a new, as yet undefined, slot
	 */
	public int allocate(String name) {
		checkNotFrozen();
		names.add(requireNonNull(name));
		definitions.add(null);
		return definitions.size() - 1;
	}

	public void define(int handle, SpecNode definition) {
		checkNotFrozen();
		requireNonNull(definition);
		if (definition instanceof RefNode r && r.handle() == handle) {
			throw new IllegalArgumentException("Slot " + handle + " can't be defined as a reference to itself");
		}
		if (definitions.get(handle) != null) {
			throw new IllegalStateException("Slot " + handle + " (" + names.get(handle) + ") is already defined");
		}
		definitions.set(handle, definition);
	}

	/**
	 * @throws IllegalStateException if the slot is allocated but not yet defined
	 */
	public SpecNode get(int handle) {
		SpecNode result = definitions.get(handle);
		if (result == null) {
			throw new IllegalStateException("Slot " + handle + " (" + names.get(handle) + ") is not defined yet");
		}
		return result;
	}

	public SpecNode resolve(RefNode ref) {
		return get(ref.handle());
	}

	public String nameOf(int handle) {
		return names.get(handle);
	}

	public int size() {
		return definitions.size();
	}

	public void freeze() {
		isFrozen.set(true);
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	private void checkNotFrozen() {
		if (isFrozen.get()) {
			throw new IllegalStateException("SpecGraph is frozen");
		}
	}

	public String contentDescription() {
		StringBuilder sb = new StringBuilder("{\n");
		for (int i = 0; i < definitions.size(); i++) {
			sb.append("\t@").append(i).append(" '").append(names.get(i)).append("': ").append(definitions.get(i)).append("\n");
		}
		return sb.append("}").toString();
	}

	@Override
	public String toString() {
		return names.stream().collect(joining(", ", "SpecGraph[", "]"));
	}
}
