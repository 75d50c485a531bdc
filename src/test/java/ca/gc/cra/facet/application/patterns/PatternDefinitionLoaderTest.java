package ca.gc.cra.facet.application.patterns;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatternDefinitionLoaderTest {
  @TempDir Path tempDir;

  private final PatternDefinitionLoader loader = new PatternDefinitionLoader();

  @Test
  void loadsPatternsWithTierByRankOrName() throws IOException {
    Path file = write("custom.yaml", """
        version: 1
        patterns:
          - name: measurement.storage
            category: measurement
            tier: 3
            regex: '\\b(?<value>\\d{1,9}(?:\\.\\d{1,9})?)\\s{0,3}(?<unit>GB|TB)\\b'
          - name: money.shortfall
            category: MONEY
            tier: negative_scalar
            regex: '\\bshortfall\\s{1,3}of\\s{1,3}(?<value>\\$\\d{1,9})'
            guard: 'no$'
        """);

    List<PatternSource> sources = loader.load(List.of(file));

    assertEquals(2, sources.size());
    PatternSource storage = sources.get(0);
    assertEquals(EntityCategory.MEASUREMENT, storage.category());
    assertEquals(Tier.COMPLETE_SINGLE, storage.tier());
    assertEquals(Set.of(CaptureRole.VALUE, CaptureRole.UNIT), storage.roles());
    assertNull(storage.guard());
    PatternSource shortfall = sources.get(1);
    assertEquals(Tier.NEGATIVE_SCALAR, shortfall.tier());
    assertEquals("no$", shortfall.guard());
  }

  @Test
  void rejectsDuplicateNamesAcrossFiles() throws IOException {
    String body = """
        version: 1
        patterns:
          - name: dup
            category: money
            tier: 5
            regex: '(?<value>\\d{1,9})'
        """;
    Path first = write("a.yaml", body);
    Path second = write("b.yaml", body);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.load(List.of(first, second)));
    assertTrue(ex.getMessage().contains("Duplicate pattern name detected: dup"));
  }

  @Test
  void rejectsUnsupportedVersion() throws IOException {
    Path file = write("v2.yaml", "version: 2\npatterns: []\n");

    assertThrows(IllegalArgumentException.class, () -> loader.load(List.of(file)));
  }

  @Test
  void rejectsMissingFields() throws IOException {
    Path file = write("missing.yaml", """
        version: 1
        patterns:
          - name: no.regex
            category: money
            tier: 5
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.load(List.of(file)));
    assertTrue(ex.getMessage().contains("Missing required field: regex"));
  }

  @Test
  void rejectsUnknownTierAndCategory() throws IOException {
    Path badTier = write("tier.yaml", """
        version: 1
        patterns:
          - {name: t, category: money, tier: 9, regex: '(?<value>\\d{1,9})'}
        """);
    Path badCategory = write("category.yaml", """
        version: 1
        patterns:
          - {name: c, category: weight, tier: 5, regex: '(?<value>\\d{1,9})'}
        """);

    assertThrows(IllegalArgumentException.class, () -> loader.load(List.of(badTier)));
    assertThrows(IllegalArgumentException.class, () -> loader.load(List.of(badCategory)));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path file = write("broken.yaml", "version: 1\npatterns: [ {name: x\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> loader.load(List.of(file)));
    assertTrue(ex.getMessage().startsWith("Failed to parse YAML patterns"));
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(IOException.class, () -> loader.load(List.of(tempDir.resolve("absent.yaml"))));
  }

  @Test
  void emptyDocumentYieldsNoPatterns() throws IOException {
    Path file = write("empty.yaml", "");

    assertTrue(loader.load(List.of(file)).isEmpty());
  }

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content);
    return file;
  }
}
