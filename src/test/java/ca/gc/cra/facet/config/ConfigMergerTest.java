package ca.gc.cra.facet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> yaml = Map.of("categories", "money", "strict", "true");
    Map<String, String> cli = Map.of("categories", "date,time");

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml), cli, ExtractConfig.defaultsAsFlatMap(), warnings::add);

    assertEquals("date,time", merged.get("categories"));
    assertEquals("true", merged.get("strict"));
    assertEquals("false", merged.get("metrics"));
    assertEquals(List.of("CLI overrides YAML for key: categories"), warnings);
  }

  @Test
  void noWarningWhenYamlIsAbsent() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("metrics", "on"), ExtractConfig.defaultsAsFlatMap(), warnings::add);

    assertEquals("on", merged.get("metrics"));
    assertEquals(List.of(), warnings);
  }

  @Test
  void invalidMergedValuesAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.of(Map.of("maxInputBytes", "lots")), Map.of(),
            ExtractConfig.defaultsAsFlatMap(), null));
    assertEquals("maxInputBytes must be an integer (was 'lots')", ex.getMessage());

    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.empty(), Map.of("categories", "weather"),
            ExtractConfig.defaultsAsFlatMap(), null));
  }
}
