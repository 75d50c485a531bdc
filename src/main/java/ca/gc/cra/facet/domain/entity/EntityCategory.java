package ca.gc.cra.facet.domain.entity;

import java.util.Locale;

/**
 * Fact categories recognised by the extractor.
 *
 * @since FACET 0.1.0
 */
public enum EntityCategory {
  DATE,
  TIME,
  MONEY,
  MEASUREMENT;

  /**
   * Parses a category name, ignoring case and surrounding whitespace.
   *
   * @param raw category label such as {@code money}
   * @return matching category
   * @throws IllegalArgumentException when the label is blank or unknown
   */
  public static EntityCategory parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (EntityCategory category : values()) {
      if (category.name().equals(normalized)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown entity category: " + raw);
  }
}
