/**
 * Configuration trees: nodes, leaf value kinds, source descriptors and overwriting regimes.
 */
package ca.gc.cra.strata.domain.tree;
