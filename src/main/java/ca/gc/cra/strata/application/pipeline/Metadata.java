package ca.gc.cra.strata.application.pipeline;

import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Saved-file metadata written under {@code config_metadata}.
 *
 * <p>Text form: {@code Saving time : <ctime> (<epoch seconds>) ; Regime : <regime>[ ; Variation : <name>]}.</p>
 *
 * @param savingTime human-readable saving time
 * @param epochSeconds saving time in seconds since the epoch
 * @param regime overwriting regime at save time
 * @param variationName variation name, {@code null} for a non-variation config
 * @since 0.1.0
 */
public record Metadata(String savingTime, double epochSeconds, OverwritingRegime regime, String variationName) {
  private static final DateTimeFormatter CTIME =
      DateTimeFormatter.ofPattern("EEE MMM ppd HH:mm:ss yyyy", Locale.ENGLISH);
  private static final Pattern FORMAT = Pattern.compile(
      "^Saving time : (.*) \\(([^()]*)\\) ; Regime : ([^;]+?)(?: ; Variation : (.*))?$");

  public Metadata {
    Objects.requireNonNull(savingTime, "savingTime");
    Objects.requireNonNull(regime, "regime");
  }

  /**
   * Builds metadata for a save happening at {@code epochMillis}.
   *
   * @param epochMillis saving time
   * @param zone zone used for the human-readable time
   * @param regime overwriting regime
   * @param variationName variation name or {@code null}
   * @return metadata
   */
  public static Metadata at(long epochMillis, ZoneId zone, OverwritingRegime regime, String variationName) {
    Instant instant = Instant.ofEpochMilli(epochMillis);
    return new Metadata(CTIME.format(instant.atZone(zone)), epochMillis / 1000.0, regime, variationName);
  }

  /**
   * Parses the metadata value found in a source.
   *
   * @param raw value stored under the metadata key
   * @return parsed metadata
   * @throws StructureException when the value is not well-formed metadata
   */
  public static Metadata parse(Object raw) {
    if (!(raw instanceof String text)) {
      throw new StructureException("Config metadata must be a string, got: " + raw, "config_metadata");
    }
    Matcher matcher = FORMAT.matcher(text.trim());
    if (!matcher.matches()) {
      throw new StructureException("Malformed config metadata: " + text, "config_metadata");
    }
    try {
      return new Metadata(matcher.group(1), Double.parseDouble(matcher.group(2).trim()),
          OverwritingRegime.fromLabel(matcher.group(3).trim()), matcher.group(4));
    } catch (IllegalArgumentException ex) {
      throw new StructureException("Malformed config metadata: " + text, "config_metadata", ex);
    }
  }

  public Optional<String> variation() {
    return Optional.ofNullable(variationName);
  }

  /**
   * Renders the text form.
   *
   * @return metadata string
   */
  public String format() {
    String text = "Saving time : " + savingTime + " (" + String.format(Locale.ROOT, "%.6f", epochSeconds)
        + ") ; Regime : " + regime.label();
    return variationName == null ? text : text + " ; Variation : " + variationName;
  }
}
