package works.vigil.spec;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpecGraphTest {

	@Test
	void allocateThenDefine() {
		SpecGraph graph = new SpecGraph();
		int handle = graph.allocate("Tree");
		assertThrows(IllegalStateException.class, () -> graph.get(handle));
		SpecNode definition = ContainerNode.sequence(List.class, new RefNode(handle));
		graph.define(handle, definition);
		assertEquals(definition, graph.resolve(new RefNode(handle)));
		assertEquals("Tree", graph.nameOf(handle));
	}

	@Test
	void selfReference_rejected() {
		SpecGraph graph = new SpecGraph();
		int handle = graph.allocate("Loop");
		assertThrows(IllegalArgumentException.class, () -> graph.define(handle, new RefNode(handle)));
	}

	@Test
	void redefinition_rejected() {
		SpecGraph graph = new SpecGraph();
		int handle = graph.allocate("X");
		graph.define(handle, IgnorableNode.INSTANCE);
		assertThrows(IllegalStateException.class, () -> graph.define(handle, IgnorableNode.INSTANCE));
	}

	@Test
	void frozen_rejectsChanges() {
		SpecGraph graph = new SpecGraph();
		graph.freeze();
		assertThrows(IllegalStateException.class, () -> graph.allocate("X"));
	}

	@Test
	void reducedSpec_resolvesRefs() {
		SpecGraph graph = new SpecGraph();
		int handle = graph.allocate("Int");
		graph.define(handle, new AtomicNode(Integer.class));
		graph.freeze();
		ReducedSpec spec = new ReducedSpec(new RefNode(handle), graph);
		assertEquals(new AtomicNode(Integer.class), spec.resolve(spec.root()));
		assertEquals(IgnorableNode.INSTANCE, spec.resolve(IgnorableNode.INSTANCE));
	}
}
