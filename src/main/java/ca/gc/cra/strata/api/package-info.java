/**
 * Command-line entry point of the strata configuration tool.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and runs the
 * build pipeline.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 */
package ca.gc.cra.strata.api;
