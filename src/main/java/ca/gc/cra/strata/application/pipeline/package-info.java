/**
 * Build pipeline producing {@link ca.gc.cra.strata.application.pipeline.ExperimentConfig} instances.
 * <p>Default source, experiment sources, command-line overrides and post-processing run in that order. Builders and
 * configs are stateful and not thread-safe; create one per experiment.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.pipeline;
