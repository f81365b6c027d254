/**
 * Tool options and composition root wiring for the configuration engine.
 * <p><strong>Role:</strong> Bootstrap layer selecting source readers, writers and directory adapters.</p>
 * <p><strong>Concurrency:</strong> Option objects are immutable; safe to share.</p>
 */
package ca.gc.cra.strata.config;
