package ca.gc.cra.facet.domain.lexicon;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Normalizes numeric literals, sign glyphs, and scale suffixes into {@code double} values.
 * <p><strong>Why:</strong> Document text writes the same amount many ways ({@code -$1.5M}, {@code −1,500,000},
 * {@code 1.5 million}); parsers need one canonical value.</p>
 * <p><strong>Role:</strong> Domain lexicon used by the entity parser for MONEY and MEASUREMENT bounds.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Performance:</strong> Linear scans over short matched slices; patterns precompiled.</p>
 * <p><strong>Observability:</strong> None; parse failures are reported as empty results.</p>
 *
 * @since FACET 0.1.0
 * @see UnitLexicon
 */
public final class NumberLexicon {
  /** Canonical minus plus the Unicode minus, en dash, and em dash used as signs. */
  public static final String SIGN_CHARS = "-−–—";

  private static final Pattern SIGN_GLYPHS = Pattern.compile("[−–—]");
  private static final Pattern CURRENCY = Pattern.compile(
      "[" + UnitLexicon.CURRENCY_SYMBOLS + "]|\\b(?:" + UnitLexicon.CURRENCY_CODES + ")\\b");
  private static final Pattern SCALE_WORD =
      Pattern.compile("\\b(thousand|million|billion|trillion)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern SCALE_SUFFIX = Pattern.compile("\\d\\s?([KkMmBbT])\\b");
  private static final Pattern NUMBER = Pattern.compile("(-)?\\s*(\\d[\\d,]*(?:\\.\\d+)?|\\.\\d+)");

  private NumberLexicon() {
    // Utility
  }

  /**
   * Parses a number including any scale suffix.
   *
   * @param text matched slice such as {@code "$1.5 million"} or {@code "−20"}; may be {@code null}
   * @return scaled value, or empty when no digit sequence is present or the scaled value is not finite
   */
  public static OptionalDouble parseNumber(String text) {
    OptionalDouble mantissa = parseMantissa(text);
    if (mantissa.isEmpty()) {
      return mantissa;
    }
    return finite(mantissa.getAsDouble() * scaleOf(text));
  }

  /**
   * Parses the leading number without applying any scale suffix.
   *
   * @param text matched slice; may be {@code null}
   * @return signed mantissa, or empty when no digit sequence is present or the literal overflows a double
   */
  public static OptionalDouble parseMantissa(String text) {
    if (text == null || text.isEmpty()) {
      return OptionalDouble.empty();
    }
    String normalized = CURRENCY.matcher(normalizeSigns(text)).replaceAll("");
    Matcher matcher = NUMBER.matcher(normalized);
    if (!matcher.find()) {
      return OptionalDouble.empty();
    }
    String digits = matcher.group(2).replace(",", "");
    if (digits.isEmpty() || digits.equals(".")) {
      return OptionalDouble.empty();
    }
    double value;
    try {
      value = Double.parseDouble(digits);
    } catch (NumberFormatException ex) {
      return OptionalDouble.empty();
    }
    return finite(matcher.group(1) != null ? -value : value);
  }

  /**
   * Wraps {@code value} unless it is infinite or NaN.
   *
   * @param value candidate value
   * @return the value, or empty when it cannot be formatted as a decimal
   */
  public static OptionalDouble finite(double value) {
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  /**
   * Returns the multiplier implied by a scale word or suffix letter.
   *
   * @param text matched slice; may be {@code null}
   * @return multiplier, {@code 1.0} when no scale is present
   */
  public static double scaleOf(String text) {
    if (text == null || text.isEmpty()) {
      return 1.0;
    }
    Matcher word = SCALE_WORD.matcher(text);
    if (word.find()) {
      return switch (word.group(1).toLowerCase(Locale.ROOT)) {
        case "thousand" -> 1e3;
        case "million" -> 1e6;
        case "billion" -> 1e9;
        default -> 1e12;
      };
    }
    Matcher suffix = SCALE_SUFFIX.matcher(text);
    if (suffix.find()) {
      return switch (Character.toUpperCase(suffix.group(1).charAt(0))) {
        case 'K' -> 1e3;
        case 'M' -> 1e6;
        case 'B' -> 1e9;
        default -> 1e12;
      };
    }
    return 1.0;
  }

  /**
   * Indicates whether the slice carries a scale word or suffix.
   *
   * @param text matched slice; may be {@code null}
   * @return {@code true} when {@link #scaleOf(String)} differs from {@code 1.0}
   */
  public static boolean hasScale(String text) {
    return scaleOf(text) != 1.0;
  }

  /**
   * Rewrites every sign glyph to the ASCII hyphen-minus.
   *
   * @param text input text; must not be {@code null}
   * @return text with canonical minus signs
   */
  public static String normalizeSigns(String text) {
    return SIGN_GLYPHS.matcher(text).replaceAll("-");
  }

  /**
   * Formats a value as a plain decimal string without exponent or trailing zeros.
   *
   * @param value finite value
   * @return canonical decimal text, {@code "0"} for both zeros
   */
  public static String format(double value) {
    if (value == 0.0) {
      return "0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
