/**
 * Turns raw hints into {@link works.vigil.spec.SpecNode} trees.
 * <p>
 * {@link works.vigil.scan.SignClassifier} decides what kind of hint each object is;
 * {@link works.vigil.scan.SpecScanner} uses that to build the tree, recursing into arguments.
 */
package works.vigil.scan;
