/**
 * <strong>Purpose:</strong> Ports between the configuration engine and its environment: document reading and
 * writing, experiment directories and time.
 * <p><strong>Concurrency:</strong> Engine calls are single-threaded; adapters need no synchronization unless shared.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.port;
