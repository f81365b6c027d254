/**
 * Time adapters backed by the system clock.
 */
package ca.gc.cra.strata.infrastructure.time;
