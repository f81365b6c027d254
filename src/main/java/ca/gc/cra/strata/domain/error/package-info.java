/**
 * Error taxonomy raised by the configuration engine. Every type extends
 * {@link ca.gc.cra.strata.domain.error.ConfigException} and carries the offending path when known.
 */
package ca.gc.cra.strata.domain.error;
