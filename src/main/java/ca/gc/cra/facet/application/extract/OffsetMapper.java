package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.domain.entity.Span;

/**
 * Converts UTF-16 offsets produced by {@link java.util.regex.Matcher} into codepoint offsets.
 *
 * <p>Text without supplementary characters maps to itself; otherwise a prefix table is built once per call.</p>
 *
 * @since FACET 0.1.0
 */
final class OffsetMapper {
  private final int[] codePointAt;

  private OffsetMapper(int[] codePointAt) {
    this.codePointAt = codePointAt;
  }

  static OffsetMapper of(String text) {
    if (text.length() == text.codePointCount(0, text.length())) {
      return new OffsetMapper(null);
    }
    int[] table = new int[text.length() + 1];
    int codePoints = 0;
    int i = 0;
    while (i < text.length()) {
      table[i] = codePoints;
      if (Character.isHighSurrogate(text.charAt(i)) && i + 1 < text.length()
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        table[i + 1] = codePoints;
        i += 2;
      } else {
        i++;
      }
      codePoints++;
    }
    table[text.length()] = codePoints;
    return new OffsetMapper(table);
  }

  boolean isIdentity() {
    return codePointAt == null;
  }

  int toCodePoint(int utf16Offset) {
    return codePointAt == null ? utf16Offset : codePointAt[utf16Offset];
  }

  Span toCodePoints(Span utf16Span) {
    if (codePointAt == null) {
      return utf16Span;
    }
    return new Span(toCodePoint(utf16Span.start()), toCodePoint(utf16Span.end()));
  }
}
