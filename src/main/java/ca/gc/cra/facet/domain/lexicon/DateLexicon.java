package ca.gc.cra.facet.domain.lexicon;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the supported calendar formats into {@link PartialDate} values.
 *
 * <p>Recognised shapes: {@code Month D[, YYYY]}, {@code D Month[ YYYY]}, {@code YYYY-MM-DD},
 * {@code MM/DD/YYYY}, {@code Month YYYY}, and a bare day {@code D}. Days may carry
 * {@code st/nd/rd/th}; months may be abbreviated, with or without a trailing period.</p>
 *
 * @since FACET 0.1.0
 */
public final class DateLexicon {
  private static final String MONTH_NAMES = "January|February|March|April|May|June|July|August"
      + "|September|October|November|December|Jan|Feb|Mar|Apr|Jun|Jul|Aug|Sept|Sep|Oct|Nov|Dec";

  /** Month name alternation, matched case-insensitively, with an optional abbreviation period. */
  public static final String MONTH_PATTERN = "(?i:" + MONTH_NAMES + ")\\b\\.?";

  private static final List<String> MONTH_PREFIXES = List.of(
      "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
  private static final String MONTH = "(" + MONTH_NAMES + ")\\.?";
  private static final String DAY = "(\\d{1,2})(?:st|nd|rd|th)?";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE;

  private static final Pattern ISO = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
  private static final Pattern US = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4})");
  private static final Pattern MONTH_YEAR = Pattern.compile(MONTH + ",?\\s+(\\d{4})", FLAGS);
  private static final Pattern MONTH_DAY_YEAR =
      Pattern.compile(MONTH + "\\s+" + DAY + "(?:,?\\s+(\\d{4}))?", FLAGS);
  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile(DAY + "\\s+" + MONTH + "(?:,?\\s+(\\d{4}))?", FLAGS);
  private static final Pattern DAY_ONLY = Pattern.compile(DAY, FLAGS);

  private DateLexicon() {
    // Utility
  }

  /**
   * Parses a date slice without validating the calendar date.
   *
   * @param text matched slice; may be {@code null}
   * @return parsed fields, or empty when the slice has no supported shape
   */
  public static Optional<PartialDate> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String trimmed = text.strip();
    Matcher m = ISO.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3))));
    }
    m = US.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(toInt(m.group(3)), toInt(m.group(1)), toInt(m.group(2))));
    }
    m = MONTH_YEAR.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(toInt(m.group(2)), monthNumber(m.group(1)), 0));
    }
    m = MONTH_DAY_YEAR.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(toInt(m.group(3)), monthNumber(m.group(1)), toInt(m.group(2))));
    }
    m = DAY_MONTH_YEAR.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(toInt(m.group(3)), monthNumber(m.group(2)), toInt(m.group(1))));
    }
    m = DAY_ONLY.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new PartialDate(0, 0, toInt(m.group(1))));
    }
    return Optional.empty();
  }

  /**
   * Parses a four-digit year slice.
   *
   * @param text year text; may be {@code null}
   * @return year, or {@code 0} when absent or malformed
   */
  public static int parseYear(String text) {
    if (text == null || !text.strip().matches("\\d{4}")) {
      return 0;
    }
    return toInt(text.strip());
  }

  static int monthNumber(String name) {
    String prefix = name.substring(0, 3).toLowerCase(Locale.ROOT);
    return MONTH_PREFIXES.indexOf(prefix) + 1;
  }

  private static int toInt(String digits) {
    return digits == null ? 0 : Integer.parseInt(digits);
  }
}
