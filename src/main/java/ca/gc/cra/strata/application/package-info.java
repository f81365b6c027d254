/**
 * Application services building, mutating and expanding experiment configurations.
 * <p><strong>Role:</strong> Use cases depend on ports only; adapters are wired by {@code ca.gc.cra.strata.config}.</p>
 */
package ca.gc.cra.strata.application;
