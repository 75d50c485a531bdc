package ca.gc.cra.facet.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.application.patterns.PatternDefinition;
import ca.gc.cra.facet.application.patterns.Tier;
import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class SpanAllocatorTest {
  private static final PatternDefinition PATTERN = new PatternDefinition(
      "test.amount", EntityCategory.MONEY, Tier.BARE_SCALAR, Pattern.compile("\\d+"), Map.of(), null);

  @Test
  void firstClaimWinsAndOverlapsAreRefused() {
    SpanAllocator allocator = new SpanAllocator();

    assertTrue(allocator.tryCommit(10, 20, PATTERN).isPresent());
    assertTrue(allocator.tryCommit(15, 25, PATTERN).isEmpty());
    assertTrue(allocator.tryCommit(5, 11, PATTERN).isEmpty());
    assertTrue(allocator.tryCommit(12, 13, PATTERN).isEmpty());
    assertTrue(allocator.tryCommit(0, 30, PATTERN).isEmpty());
    assertEquals(1, allocator.size());
  }

  @Test
  void adjacentSpansDoNotOverlap() {
    SpanAllocator allocator = new SpanAllocator();
    allocator.tryCommit(10, 20, PATTERN);

    assertFalse(allocator.overlaps(20, 25));
    assertFalse(allocator.overlaps(5, 10));
    assertTrue(allocator.tryCommit(20, 25, PATTERN).isPresent());
    assertTrue(allocator.tryCommit(5, 10, PATTERN).isPresent());
    assertEquals(3, allocator.committed().size());
    assertEquals(5, allocator.committed().get(0).start());
  }

  @Test
  void zeroWidthSpanIsNeverCommitted() {
    SpanAllocator allocator = new SpanAllocator();

    assertTrue(allocator.tryCommit(4, 4, PATTERN).isEmpty());
    assertEquals(0, allocator.size());
  }
}
