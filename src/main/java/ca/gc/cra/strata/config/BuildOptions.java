package ca.gc.cra.strata.config;

import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import java.util.Objects;

/**
 * Switches controlling how a configuration is built.
 *
 * @param regime overwriting regime applied once construction completes
 * @param mergeCommandLine whether command-line overrides are merged
 * @param preProcess whether pre-processing rules run while merging
 * @param postProcess whether post-processing rules run at the end of each pipeline
 * @param strictCommandLine whether command-line names matching nothing are errors instead of warnings
 * @param verbose whether DEBUG logging is enabled by the command-line tool
 * @since 0.1.0
 */
public record BuildOptions(
    OverwritingRegime regime,
    boolean mergeCommandLine,
    boolean preProcess,
    boolean postProcess,
    boolean strictCommandLine,
    boolean verbose) {

  public BuildOptions {
    Objects.requireNonNull(regime, "regime");
  }

  /**
   * Returns the defaults: auto-save, command line merged, both processing phases on, lenient command line.
   *
   * @return default options
   */
  public static BuildOptions defaults() {
    return new BuildOptions(OverwritingRegime.AUTO_SAVE, true, true, true, false, false);
  }

  public BuildOptions withRegime(OverwritingRegime newRegime) {
    return new BuildOptions(newRegime, mergeCommandLine, preProcess, postProcess, strictCommandLine, verbose);
  }
}
