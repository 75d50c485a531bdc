package ca.gc.cra.facet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExtractConfigTest {

  @Test
  void defaultsSelectEveryCategory() {
    ExtractConfig config = ExtractConfig.defaults();

    assertEquals(EnumSet.allOf(EntityCategory.class), config.categories());
    assertTrue(config.patternFiles().isEmpty());
    assertFalse(config.strict());
    assertFalse(config.metricsEnabled());
    assertEquals(ExtractConfig.DEFAULT_MAX_INPUT_BYTES, config.maxInputBytes());
    assertEquals("DATE,TIME,MONEY,MEASUREMENT", config.categoriesText());
  }

  @Test
  void flatDefaultsRoundTripToDefaults() {
    assertEquals(ExtractConfig.defaults(), ExtractConfig.fromMap(ExtractConfig.defaultsAsFlatMap()));
  }

  @Test
  void fromMapParsesEveryKey() {
    ExtractConfig config = ExtractConfig.fromMap(Map.of(
        "categories", " money , Date ",
        "patterns", "a.yaml, b/c.yaml",
        "strict", "Yes",
        "metrics", "off",
        "maxInputBytes", "2048"));

    assertEquals(Set.of(EntityCategory.MONEY, EntityCategory.DATE), config.categories());
    assertEquals("DATE,MONEY", config.categoriesText());
    assertEquals(List.of(Path.of("a.yaml"), Path.of("b/c.yaml")), config.patternFiles());
    assertTrue(config.strict());
    assertFalse(config.metricsEnabled());
    assertEquals(2048L, config.maxInputBytes());
  }

  @Test
  void blankValuesTakeDefaults() {
    ExtractConfig config = ExtractConfig.fromMap(Map.of("categories", " ", "strict", "", "maxInputBytes", ""));

    assertEquals(ExtractConfig.defaults(), config);
  }

  @Test
  void rejectsInvalidValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ExtractConfig.fromMap(Map.of("strict", "maybe")));
    assertEquals("strict must be true or false (was 'maybe')", ex.getMessage());

    ex = assertThrows(IllegalArgumentException.class,
        () -> ExtractConfig.fromMap(Map.of("categories", "money,weather")));
    assertEquals("Unknown entity category: weather", ex.getMessage());

    assertThrows(IllegalArgumentException.class, () -> ExtractConfig.fromMap(Map.of("maxInputBytes", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> ExtractConfig.fromMap(Map.of("maxInputBytes", Long.toString(ExtractConfig.MAX_INPUT_BYTES_LIMIT + 1))));
  }

  @Test
  void constructorRequiresACategoryAndCopiesCollections() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExtractConfig(Set.of(), List.of(), false, false, 10));

    ExtractConfig config = new ExtractConfig(EnumSet.of(EntityCategory.TIME), null, false, false, 10);
    assertEquals(List.of(), config.patternFiles());
    assertThrows(UnsupportedOperationException.class, () -> config.categories().clear());
  }
}
