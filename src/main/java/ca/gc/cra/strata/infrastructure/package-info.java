/**
 * Adapters implementing the application ports: YAML and JSON sources, YAML output, experiment directories and
 * time.
 */
package ca.gc.cra.strata.infrastructure;
