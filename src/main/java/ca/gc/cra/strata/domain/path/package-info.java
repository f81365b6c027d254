/**
 * Dotted path patterns and their resolution against configuration trees.
 */
package ca.gc.cra.strata.domain.path;
