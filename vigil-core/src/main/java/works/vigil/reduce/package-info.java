/**
 * Canonicalization of {@link works.vigil.spec.SpecNode} trees.
 * <p>
 * The execution model is that a {@link works.vigil.spec.RefNode RefNode} is akin to a method call:
 * it enables recursion, but it's also a barrier that the synthesizer must go through indirectly.
 * The {@link works.vigil.reduce.Reducer Reducer} therefore only introduces one where a
 * forward reference actually refers back to itself, and inlines every other definition.
 */
package works.vigil.reduce;
