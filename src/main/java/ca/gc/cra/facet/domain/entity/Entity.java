package ca.gc.cra.facet.domain.entity;

/**
 * <strong>What:</strong> A typed fact found in document text.
 * <p><strong>Why:</strong> Gives frontmatter writers and fact exporters one neutral shape for dates, times,
 * money amounts, and measurements.</p>
 * <p><strong>Role:</strong> Sealed domain type; {@link RangeEntity} carries two bounds, {@link ScalarEntity} one.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * <p>Numeric encodings per category: MONEY and MEASUREMENT hold the amount; DATE holds the epoch day;
 * TIME holds seconds since midnight. {@code normalized*} fields carry the canonical text form.</p>
 *
 * @since FACET 0.1.0
 */
public sealed interface Entity permits RangeEntity, ScalarEntity {

  /**
   * Returns the fact category.
   *
   * @return category; never {@code null}
   */
  EntityCategory category();

  /**
   * Returns whether this entity is a range or a scalar.
   *
   * @return entity kind
   */
  EntityKind kind();

  /**
   * Returns the span of the match that produced this entity.
   *
   * @return half-open span
   */
  Span span();

  /**
   * Returns the unit token, or an empty string when none was found.
   *
   * @return unit text such as {@code "%"} or {@code "$"}
   */
  String unit();

  /**
   * Returns the exact matched text.
   *
   * @return raw text slice
   */
  String rawText();

  /**
   * Returns the name of the pattern that produced this entity.
   *
   * @return pattern name
   */
  String pattern();

  /**
   * Returns the priority tier rank (1 is widest) of the producing pattern.
   *
   * @return tier rank between 1 and 5
   */
  int tier();

  /**
   * Returns a copy of this entity positioned at {@code span}.
   *
   * @param span replacement span
   * @return re-positioned entity
   */
  Entity withSpan(Span span);
}
