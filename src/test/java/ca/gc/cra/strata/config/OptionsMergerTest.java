package ca.gc.cra.strata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OptionsMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of("regime", "locked", "postProcess", "false");
    Map<String, String> cli = Map.of("regime", "unsafe");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = OptionsMerger.buildEffectiveOptions(
        Optional.of(yaml),
        cli,
        OptionsMerger.defaults(),
        warnings::add);

    assertEquals("unsafe", merged.get("regime"));
    assertEquals("false", merged.get("postProcess"));
    assertEquals(List.of("CLI overrides YAML for key: regime"), warnings);
  }

  @Test
  void defaultsConvertToDefaultOptions() {
    BuildOptions options = OptionsMerger.toBuildOptions(OptionsMerger.defaults());

    assertEquals(BuildOptions.defaults(), options);
  }

  @Test
  void booleansAcceptCommonSpellings() {
    BuildOptions options = OptionsMerger.toBuildOptions(Map.of(
        "regime", "AUTO_SAVE",
        "mergeCommandLine", "no",
        "strictCommandLine", "YES",
        "verbose", "1"));

    assertEquals(OverwritingRegime.AUTO_SAVE, options.regime());
    assertFalse(options.mergeCommandLine());
    assertTrue(options.strictCommandLine());
    assertTrue(options.verbose());
    assertTrue(options.preProcess());
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> OptionsMerger.toBuildOptions(Map.of("preProcess", "sometimes")));
    assertThrows(IllegalArgumentException.class,
        () -> OptionsMerger.toBuildOptions(Map.of("regime", "frozen")));
  }
}
