/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and shorten values before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for merge reports and CLI diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.logging;
