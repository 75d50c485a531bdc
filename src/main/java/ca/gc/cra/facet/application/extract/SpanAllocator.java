package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.application.patterns.PatternDefinition;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Records committed regions and refuses any candidate that overlaps one.
 * <p><strong>Why:</strong> Wider tiers run first, so the first claim on a region is the one that must win.</p>
 * <p><strong>Role:</strong> Per-call state owned by {@link EntityExtractor}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per extraction call.</p>
 * <p><strong>Performance:</strong> Committed spans never overlap, so the only candidate conflict is the nearest
 * span starting before the candidate's end; lookups and inserts are {@code O(log n)}.</p>
 *
 * @since FACET 0.1.0
 */
final class SpanAllocator {
  private final TreeMap<Integer, CommittedSpan> committed = new TreeMap<>();

  /**
   * Checks a candidate region against committed spans.
   *
   * @param start inclusive start offset
   * @param end exclusive end offset
   * @return {@code true} when at least one offset is already claimed
   */
  boolean overlaps(int start, int end) {
    Map.Entry<Integer, CommittedSpan> before = committed.floorEntry(end - 1);
    return before != null && before.getValue().end() > start;
  }

  /**
   * Commits a candidate region unless it is empty or overlaps a committed span.
   *
   * @param start inclusive start offset
   * @param end exclusive end offset
   * @param pattern claiming pattern
   * @return committed span, or empty when refused
   */
  Optional<CommittedSpan> tryCommit(int start, int end, PatternDefinition pattern) {
    if (end <= start || overlaps(start, end)) {
      return Optional.empty();
    }
    CommittedSpan span = new CommittedSpan(start, end, pattern);
    committed.put(start, span);
    return Optional.of(span);
  }

  /**
   * Returns committed spans ordered by start offset.
   *
   * @return immutable snapshot
   */
  List<CommittedSpan> committed() {
    return List.copyOf(committed.values());
  }

  int size() {
    return committed.size();
  }
}
