/**
 * Core model of hierarchical experiment configurations.
 * <p><strong>Role:</strong> Domain layer describing trees, paths and errors without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Value types are immutable; configuration trees are single-threaded.</p>
 */
package ca.gc.cra.strata.domain;
