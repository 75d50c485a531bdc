package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.application.patterns.PatternDefinition;
import java.util.Objects;

/**
 * Region claimed by a pattern during one extraction call, in UTF-16 offsets.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 * @param pattern pattern that claimed the region
 * @since FACET 0.1.0
 */
record CommittedSpan(int start, int end, PatternDefinition pattern) {

  CommittedSpan {
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
    }
    pattern = Objects.requireNonNull(pattern, "pattern");
  }
}
