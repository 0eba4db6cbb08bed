package works.vigil.spec;

/**
 * Accepts instances of {@link #type}.
 * <p>
 * Two classes get special treatment, because the JVM has no instances of them:
 * {@link Void} accepts only {@code null}, and {@link Nothing} accepts no value.
 * Every other type rejects {@code null}.
 */
public record AtomicNode(Class<?> type) implements SpecNode {
	public static final AtomicNode NONE = new AtomicNode(Void.class);
	public static final AtomicNode NOTHING = new AtomicNode(Nothing.class);

	public AtomicNode {
		assert !type.isPrimitive(): "Primitive types must be boxed: " + type;
	}

	public boolean acceptsOnlyNull() {
		return type == Void.class;
	}

	public boolean accepts(Object value) {
		if (acceptsOnlyNull()) {
			return value == null;
		} else {
			return type.isInstance(value);
		}
	}

	@Override
	public String briefIdentifier() {
		return type.getSimpleName();
	}

	@Override
	public String toString() {
		if (acceptsOnlyNull()) {
			return "None";
		} else if (type.isArray()) {
			return type.getComponentType().getSimpleName() + "[]";
		} else {
			return type.getSimpleName();
		}
	}
}
