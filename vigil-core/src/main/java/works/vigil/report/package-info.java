/**
 * Explains why a value was rejected.
 */
package works.vigil.report;
