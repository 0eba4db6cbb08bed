package works.vigil.report;

/**
 * One step from a container to one of its parts, as rendered in a {@link Diagnostic#path() path}.
 */
public sealed interface PathStep {
	String render();

	/**
	 * An element of a list, array, tuple or other iterable, by position in iteration order.
	 */
	record Index(int index) implements PathStep {
		@Override
		public String render() {
			return "[" + index + "]";
		}
	}

	/**
	 * The value a map associates with {@link #key}.
	 */
	record MapValue(Object key) implements PathStep {
		@Override
		public String render() {
			return "[" + renderKey(key) + "]";
		}
	}

	/**
	 * A map's key itself.
	 */
	record MapKey(Object key) implements PathStep {
		@Override
		public String render() {
			return ".key(" + renderKey(key) + ")";
		}
	}

	/**
	 * The content of a present {@link java.util.Optional}.
	 */
	record OptionalValue() implements PathStep {
		@Override
		public String render() {
			return ".get()";
		}
	}

	private static String renderKey(Object key) {
		return (key instanceof String s) ? "\"" + s + "\"" : String.valueOf(key);
	}
}
