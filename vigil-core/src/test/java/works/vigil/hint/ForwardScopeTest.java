package works.vigil.hint;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ForwardScopeTest {
	final ForwardScope scope = ForwardScope.create();

	@Test
	void definitions() {
		Object hint = Hint.of(List.class, Integer.class);
		scope.define("IntList", hint);
		assertEquals(Optional.of(hint), scope.lookup("IntList"));
	}

	@Test
	void redefinition_throws() {
		scope.define("X", Integer.class);
		assertThrows(IllegalStateException.class, () -> scope.define("X", String.class));
	}

	@Test
	void nullDefinition_meansNone() {
		scope.define("Nothing", null);
		assertEquals(Optional.of(Hint.NONE), scope.lookup("Nothing"));
	}

	@Test
	void definitions_shadowClasses() {
		scope.define("String", Integer.class);
		assertEquals(Optional.of(Integer.class), scope.lookup("String"));
	}

	@Test
	void classNames() {
		assertEquals(Optional.of(String.class), scope.lookup("String"));
		assertEquals(Optional.of(UUID.class), scope.lookup("java.util.UUID"));
		assertEquals(Optional.empty(), scope.lookup("UUID"));
		scope.importPackageOf(UUID.class);
		assertEquals(Optional.of(UUID.class), scope.lookup("UUID"));
	}

	@Test
	void classLoader() {
		ClassLoader loader = new ClassLoader(ForwardScope.class.getClassLoader()) { };
		ForwardScope scoped = ForwardScope.using(loader);
		assertEquals(Optional.of(ForwardScopeTest.class), scoped.lookup("works.vigil.hint.ForwardScopeTest"));
		assertEquals(Optional.of(String.class), scoped.lookup("String"));
		assertThrows(NullPointerException.class, () -> ForwardScope.using(null));
	}

	@Test
	void missing() {
		assertEquals(Optional.empty(), scope.lookup("NoSuchClassAnywhere"));
	}

	@Test
	void blankForwardRef_throws() {
		assertThrows(IllegalArgumentException.class, () -> Hint.forward(" "));
	}
}
