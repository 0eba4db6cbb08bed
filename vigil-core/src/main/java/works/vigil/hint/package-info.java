/**
 * The raw hint shapes that callers write.
 * <p>
 * Most hints are ordinary Java objects: a {@link java.lang.Class},
 * a reflective {@link java.lang.reflect.Type} (often captured with a {@link works.vigil.hint.TypeReference}),
 * a {@link java.util.function.Predicate}, or a {@link java.lang.String} naming a forward reference.
 * {@link works.vigil.hint.Hint} supplies the shapes Java has no syntax for:
 * unions, literals, tuples, and explicit subscripting.
 */
package works.vigil.hint;
