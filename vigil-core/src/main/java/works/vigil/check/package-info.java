/**
 * Synthesis and caching of {@link works.vigil.check.Checker}s.
 * <p>
 * Most callers need only a {@link works.vigil.check.CheckerCache},
 * built with {@link works.vigil.check.CheckerSettings}.
 */
package works.vigil.check;
