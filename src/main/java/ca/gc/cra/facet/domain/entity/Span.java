package ca.gc.cra.facet.domain.entity;

/**
 * <strong>What:</strong> Half-open {@code [start, end)} offset range into source text.
 * <p><strong>Why:</strong> Lets downstream writers slice the original document without re-running patterns.</p>
 * <p><strong>Role:</strong> Domain value object carried by every {@link Entity}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param start inclusive start offset; non-negative
 * @param end exclusive end offset; strictly greater than {@code start}
 * @since FACET 0.1.0
 */
public record Span(int start, int end) {

  /**
   * Validates offsets. Zero-width spans are rejected.
   *
   * @param start inclusive start offset
   * @param end exclusive end offset
   * @throws IllegalArgumentException when {@code start < 0} or {@code end <= start}
   */
  public Span {
    if (start < 0) {
      throw new IllegalArgumentException("start must be >= 0 (was " + start + ")");
    }
    if (end <= start) {
      throw new IllegalArgumentException("end must be > start (was [" + start + ", " + end + "))");
    }
  }

  /**
   * Number of offsets covered.
   *
   * @return {@code end - start}
   */
  public int length() {
    return end - start;
  }

  /**
   * Checks whether two spans share at least one offset.
   *
   * @param other span to compare; must not be {@code null}
   * @return {@code true} when the ranges intersect
   */
  public boolean overlaps(Span other) {
    return start < other.end && other.start < end;
  }
}
