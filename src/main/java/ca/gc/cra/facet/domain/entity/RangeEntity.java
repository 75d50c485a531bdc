package ca.gc.cra.facet.domain.entity;

import java.util.Objects;

/**
 * Entity with two bounds kept in textual order (a descending range such as {@code -$50,000 to -$25,000}
 * is not reordered).
 *
 * @param category fact category
 * @param startValue numeric value of the first bound as written
 * @param endValue numeric value of the second bound as written
 * @param unit unit of the first bound, or the shared unit; empty when absent
 * @param endUnit unit of the second bound; equal to {@code unit} when shared
 * @param rawStart matched text of the first bound
 * @param rawEnd matched text of the second bound
 * @param normalizedStart canonical text of the first bound
 * @param normalizedEnd canonical text of the second bound
 * @param span span of the whole construct
 * @param rawText matched text of the whole construct
 * @param pattern producing pattern name
 * @param tier producing tier rank
 * @since FACET 0.1.0
 */
public record RangeEntity(
    EntityCategory category,
    double startValue,
    double endValue,
    String unit,
    String endUnit,
    String rawStart,
    String rawEnd,
    String normalizedStart,
    String normalizedEnd,
    Span span,
    String rawText,
    String pattern,
    int tier) implements Entity {

  public RangeEntity {
    category = Objects.requireNonNull(category, "category");
    span = Objects.requireNonNull(span, "span");
    unit = unit == null ? "" : unit;
    endUnit = endUnit == null ? unit : endUnit;
    rawStart = Objects.requireNonNull(rawStart, "rawStart");
    rawEnd = Objects.requireNonNull(rawEnd, "rawEnd");
    normalizedStart = Objects.requireNonNull(normalizedStart, "normalizedStart");
    normalizedEnd = Objects.requireNonNull(normalizedEnd, "normalizedEnd");
    rawText = Objects.requireNonNull(rawText, "rawText");
    pattern = Objects.requireNonNull(pattern, "pattern");
  }

  @Override
  public EntityKind kind() {
    return EntityKind.RANGE;
  }

  @Override
  public RangeEntity withSpan(Span newSpan) {
    return new RangeEntity(category, startValue, endValue, unit, endUnit, rawStart, rawEnd,
        normalizedStart, normalizedEnd, newSpan, rawText, pattern, tier);
  }
}
