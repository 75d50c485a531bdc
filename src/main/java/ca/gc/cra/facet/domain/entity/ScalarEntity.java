package ca.gc.cra.facet.domain.entity;

import java.util.Objects;

/**
 * Entity holding a single value.
 *
 * @param category fact category
 * @param value numeric value; negative when produced by a negation cue
 * @param unit unit token; empty when absent
 * @param normalized canonical text form of {@code value}
 * @param span span of the match
 * @param rawText matched text
 * @param pattern producing pattern name
 * @param tier producing tier rank
 * @param negated whether a negation cue forced the sign
 * @since FACET 0.1.0
 */
public record ScalarEntity(
    EntityCategory category,
    double value,
    String unit,
    String normalized,
    Span span,
    String rawText,
    String pattern,
    int tier,
    boolean negated) implements Entity {

  public ScalarEntity {
    category = Objects.requireNonNull(category, "category");
    span = Objects.requireNonNull(span, "span");
    unit = unit == null ? "" : unit;
    normalized = Objects.requireNonNull(normalized, "normalized");
    rawText = Objects.requireNonNull(rawText, "rawText");
    pattern = Objects.requireNonNull(pattern, "pattern");
  }

  @Override
  public EntityKind kind() {
    return EntityKind.SCALAR;
  }

  @Override
  public ScalarEntity withSpan(Span newSpan) {
    return new ScalarEntity(category, value, unit, normalized, newSpan, rawText, pattern, tier, negated);
  }
}
