package works.vigil.scan;

import java.lang.reflect.ParameterizedType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.vigil.exceptions.UnsupportedSpecificationException;
import works.vigil.hint.Hint;
import works.vigil.hint.Subscripted;
import works.vigil.hint.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class SignClassifierTest {

	@ParameterizedTest
	@MethodSource("signs")
	void classify(Object hint, HintSign expected) {
		assertEquals(expected, SignClassifier.classify(hint));
	}

	static Stream<Arguments> signs() {
		return Stream.of(
			arguments(null, HintSign.NONE),
			arguments(Void.class, HintSign.NONE),
			arguments(void.class, HintSign.NONE),
			arguments(Hint.NONE, HintSign.NONE),
			arguments(Object.class, HintSign.IGNORABLE),
			arguments(Hint.ANY, HintSign.IGNORABLE),
			arguments(Hint.NOTHING, HintSign.NOTHING),

			arguments(Integer.class, HintSign.ATOMIC),
			arguments(int.class, HintSign.ATOMIC),
			arguments(int[].class, HintSign.ATOMIC),
			arguments(String[].class, HintSign.ARRAY),

			arguments(new TypeReference<List<String>>() { }, HintSign.SEQUENCE),
			arguments(new TypeReference<ArrayList<String>>() { }, HintSign.SEQUENCE),
			arguments(new TypeReference<Set<String>>() { }, HintSign.COLLECTION),
			arguments(new TypeReference<Iterable<String>>() { }, HintSign.COLLECTION),
			arguments(new TypeReference<Map<String, Integer>>() { }, HintSign.MAPPING),
			arguments(new TypeReference<TreeMap<String, Integer>>() { }, HintSign.MAPPING),
			arguments(new TypeReference<Optional<String>>() { }, HintSign.OPTIONAL),
			arguments(new TypeReference<Class<? extends Number>>() { }, HintSign.SUBCLASS),
			arguments(new TypeReference<Function<String, Integer>>() { }, HintSign.CALLABLE),
			arguments(new TypeReference<Comparable<String>>() { }, HintSign.GENERIC),
			arguments(new TypeReference<List<String>[]>() { }, HintSign.ARRAY),

			arguments(Hint.of(List.class, Integer.class), HintSign.SEQUENCE),
			arguments(Hint.union(Integer.class, String.class), HintSign.UNION),
			arguments(Hint.optional(Integer.class), HintSign.UNION),
			arguments(Hint.literal(1, 2, 3), HintSign.LITERAL),
			arguments(Hint.tuple(Integer.class, String.class), HintSign.TUPLE),

			arguments(Hint.annotated(Integer.class, Hint.is(x -> true)), HintSign.ANNOTATED),
			arguments(Hint.annotated(Hint.of(List.class, Integer.class), Hint.is(x -> true), Hint.is(x -> true)), HintSign.ANNOTATED),

			arguments(Hint.is(x -> true), HintSign.PREDICATE),
			arguments("SomeName", HintSign.FORWARD),
			arguments(Hint.forward("SomeName"), HintSign.FORWARD)
		);
	}

	@Test
	void typeVariablesAndWildcards() {
		var tv = Holder.class.getTypeParameters()[0];
		assertEquals(HintSign.TYPE_VARIABLE, SignClassifier.classify(tv));
		var wildcard = ((ParameterizedType) new TypeReference<List<? extends Number>>() { }
			.reflectionType()).getActualTypeArguments()[0];
		assertEquals(HintSign.WILDCARD, SignClassifier.classify(wildcard));
	}

	@Test
	void unrecognizedShape_throws() {
		Object hint = 42;
		var e = assertThrows(UnsupportedSpecificationException.class, () -> SignClassifier.classify(hint));
		assertSame(hint, e.specification());
	}

	@Test
	void nonClassOrigin_throws() {
		Subscripted hint = Hint.of("List", Integer.class);
		assertThrows(UnsupportedSpecificationException.class, () -> SignClassifier.classify(hint));
	}

	@Test
	void annotated_isClassifiedByItsOrigin() {
		var positive = Hint.is(x -> x instanceof Integer i && i > 0);
		Subscripted hint = Hint.annotated(Integer.class, positive);
		assertEquals(HintSign.ANNOTATED, SignClassifier.classify(hint));
		assertEquals(List.of(Integer.class, positive), SignClassifier.argumentsOf(hint));
	}

	@Test
	void erasure() {
		assertEquals(List.class, SignClassifier.erasure(new TypeReference<List<String>>() { }.reflectionType()));
		assertEquals(List[].class, SignClassifier.erasure(new TypeReference<List<String>[]>() { }.reflectionType()));
		assertEquals(CharSequence.class, SignClassifier.erasure(Holder.class.getTypeParameters()[0]));
	}

	@SuppressWarnings("unused")
	static class Holder<T extends CharSequence> { }
}
