/**
 * Checking values against hints on demand,
 * as opposed to at method boundaries.
 */
package works.vigil.door;
