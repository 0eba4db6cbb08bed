package works.vigil.hint;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic Java type as a hint, using the usual anonymous-subclass trick:
 *
 * <pre>
 * Object hint = new TypeReference&lt;Map&lt;String, List&lt;Integer&gt;&gt;&gt;() { };
 * </pre>
 *
 * The hint is the captured {@link #reflectionType() type}; the reference object
 * itself is only a carrier.
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	private final Type reflectionType;

	protected TypeReference() {
		this.reflectionType = ((ParameterizedType) getClass()
			.getGenericSuperclass()).getActualTypeArguments()[0];
	}

	public Type reflectionType() {
		return reflectionType;
	}

	@Override
	public String toString() {
		return "TypeReference<" + reflectionType.getTypeName() + ">";
	}
}
