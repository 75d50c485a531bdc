package ca.gc.cra.facet.application.patterns;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PatternLibraryTest {

  @Test
  void builtInLibraryCoversEveryTier() {
    PatternLibrary library = PatternLibrary.builtIn();

    assertTrue(library.rejections().isEmpty(), () -> "rejections: " + library.rejections());
    assertEquals(BuiltInPatterns.sources().size(), library.size());
    for (Tier tier : Tier.values()) {
      assertTrue(!library.patternsIn(tier).isEmpty(), () -> "no patterns in " + tier);
    }
  }

  @Test
  void patternsAreOrderedByTierThenCategory() {
    List<PatternDefinition> patterns = PatternLibrary.builtIn().patterns();

    for (int i = 1; i < patterns.size(); i++) {
      PatternDefinition previous = patterns.get(i - 1);
      PatternDefinition current = patterns.get(i);
      assertTrue(previous.tier().rank() <= current.tier().rank(), current.name());
      if (previous.tier() == current.tier()) {
        assertTrue(previous.category().ordinal() <= current.category().ordinal(), current.name());
      }
    }
  }

  @Test
  void lateSourcesSortIntoTheirTierAfterEarlierOnes() {
    PatternLibrary library = PatternLibrary.builder()
        .add(PatternSource.of("a.scalar", EntityCategory.MONEY, Tier.BARE_SCALAR, "(?<value>\\d{1,9})"))
        .add(PatternSource.of("b.range", EntityCategory.MONEY, Tier.BARE_RANGE, "(?<lo>\\d{1,9})-(?<hi>\\d{1,9})"))
        .add(PatternSource.of("c.scalar", EntityCategory.DATE, Tier.BARE_SCALAR, "(?<value>\\d{4})"))
        .build();

    List<String> names = new ArrayList<>();
    library.patterns().forEach(pattern -> names.add(pattern.name()));
    assertEquals(List.of("b.range", "a.scalar", "c.scalar"), names);
  }

  @Test
  void lenientBuildExcludesAndReportsBadPatterns() {
    PatternLibrary library = PatternLibrary.builder()
        .add(PatternSource.of("good", EntityCategory.MONEY, Tier.BARE_SCALAR, "(?<value>\\d{1,9})"))
        .add(PatternSource.of("bad", EntityCategory.MONEY, Tier.BARE_SCALAR, "(?<value>(\\d{1,9})*)"))
        .add(PatternSource.of("good", EntityCategory.DATE, Tier.BARE_SCALAR, "(?<value>\\d{4})"))
        .build();

    assertEquals(1, library.size());
    assertEquals(2, library.rejections().size());
    assertEquals("bad", library.rejections().get(0).patternName());
    assertTrue(library.rejections().get(1).reason().contains("duplicate pattern name"));
  }

  @Test
  void strictBuildFailsOnFirstBadPattern() {
    PatternLibrary.Builder builder = PatternLibrary.builder()
        .add(PatternSource.of("good", EntityCategory.MONEY, Tier.BARE_SCALAR, "(?<value>\\d{1,9})"))
        .add(PatternSource.of("bad", EntityCategory.MONEY, Tier.BARE_SCALAR, "(?<value>\\d{1,9})(?=x)"));

    PatternCompilationException ex = assertThrows(PatternCompilationException.class, builder::buildStrict);
    assertEquals("bad", ex.patternName());
  }

  @Test
  void restrictToKeepsOnlySelectedCategories() {
    PatternLibrary money = PatternLibrary.builtIn().restrictTo(EnumSet.of(EntityCategory.MONEY));

    assertTrue(money.size() > 0);
    assertTrue(money.patterns().stream().allMatch(pattern -> pattern.category() == EntityCategory.MONEY));
    assertEquals(0, PatternLibrary.builtIn().restrictTo(Set.of()).size());
  }

  @Test
  void patternsListIsImmutable() {
    PatternLibrary library = PatternLibrary.builtIn();

    assertThrows(UnsupportedOperationException.class, () -> library.patterns().clear());
  }
}
