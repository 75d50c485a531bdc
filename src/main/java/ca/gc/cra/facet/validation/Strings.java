package ca.gc.cra.facet.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> String validation utilities for FACET configuration and CLI layers.
 * <p><strong>Why:</strong> Option values arrive as raw {@code key=value} text; blanks and control characters must
 * be rejected before they reach loaders.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since FACET 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list, trimming items and skipping empty ones.
   *
   * @param name logical parameter name for diagnostics
   * @param value list text such as {@code "money, date"}; {@code null} yields an empty list
   * @return immutable list of items in input order
   * @throws IllegalArgumentException if an item contains control characters
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (String token : value.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      items.add(requireNonBlank(name, token));
    }
    return List.copyOf(items);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
