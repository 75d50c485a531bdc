package ca.gc.cra.facet.domain.lexicon;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Finds the unit token inside a matched slice for a given category.
 * <p><strong>Why:</strong> Ranges and scalars report one canonical unit ({@code "%"}, {@code "°F"}, {@code "$"})
 * regardless of where in the match it was written.</p>
 * <p><strong>Role:</strong> Domain lexicon shared by the entity parser and the pattern fragments, so the
 * unit alternations used for matching and for reading stay identical.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the currency, money-word, and measurement-unit vocabularies.</li>
 *   <li>Apply ordered per-category matchers; the first matcher with a hit wins, leftmost hit within it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> None; a missing unit is reported as an empty string, never an error.</p>
 *
 * @since FACET 0.1.0
 * @see NumberLexicon
 */
public final class UnitLexicon {
  /** Currency symbols accepted ahead of an amount (character-class body). */
  public static final String CURRENCY_SYMBOLS = "$€£¥";

  /** ISO currency codes accepted ahead of or after an amount. */
  public static final String CURRENCY_CODES = "USD|EUR|GBP|CAD|JPY";

  /** Money words accepted after an amount (matched case-insensitively). */
  public static final String MONEY_WORDS = "dollars?|euros?|bucks";

  /** Scale words (matched case-insensitively). */
  public static final String SCALE_WORDS = "thousand|million|billion|trillion";

  /** Measurement unit words, longest alternatives first (matched case-insensitively). */
  public static final String MEASUREMENT_WORDS = String.join("|",
      "millimet(?:er|re)s?", "centimet(?:er|re)s?", "kilomet(?:er|re)s?", "nanomet(?:er|re)s?",
      "met(?:er|re)s?", "inch(?:es)?", "feet", "foot", "yards?", "miles?",
      "kilograms?", "milligrams?", "grams?", "pounds?", "ounces?", "tonnes?", "tons?",
      "milliseconds?", "seconds?", "minutes?", "hours?", "days?", "weeks?", "months?", "years?",
      "decibels?", "gigahertz", "megahertz", "kilohertz", "hertz",
      "kilowatts?", "watts?", "volts?", "amps?",
      "millilit(?:er|re)s?", "lit(?:er|re)s?", "gallons?");

  /** Case-sensitive measurement unit symbols, longest alternatives first. */
  public static final String MEASUREMENT_SYMBOLS = String.join("|",
      "mAh", "mph", "mm", "mg", "mL", "ml", "mV", "mA", "mi", "m",
      "cm", "km", "nm", "kg", "kWh", "kW", "kHz", "kV", "g",
      "lbs", "lb", "oz", "ft", "yd", "dB", "GHz", "MHz", "Hz", "W", "V", "psi", "L", "gal");

  private static final String PERCENT = "%|(?i:percent)\\b";
  private static final String DEGREES =
      "°(?:\\s?[CFK]\\b)?|(?i:degrees?(?:\\s{1,3}(?:celsius|fahrenheit|kelvin))?)\\b";

  /** Full measurement-unit alternation without capturing groups. */
  public static final String MEASUREMENT_UNIT_PATTERN = "(?:" + PERCENT + "|" + DEGREES
      + "|(?i:" + MEASUREMENT_WORDS + ")\\b|(?:" + MEASUREMENT_SYMBOLS + ")\\b)";

  /** Money word or trailing currency code alternation without capturing groups. */
  public static final String MONEY_WORD_PATTERN =
      "(?:(?i:" + MONEY_WORDS + ")\\b|(?:" + CURRENCY_CODES + ")\\b)";

  private static final String LEAD = "(?:^|[^A-Za-z])";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Map<EntityCategory, List<Pattern>> MATCHERS = buildMatchers();

  private UnitLexicon() {
    // Utility
  }

  /**
   * Returns the first unit token found in {@code text} for {@code category}.
   *
   * @param text matched slice; {@code null} yields an empty string
   * @param category category whose vocabulary applies; must not be {@code null}
   * @return canonical unit text, or {@code ""} when none is present
   */
  public static String parseUnit(String text, EntityCategory category) {
    return findUnit(text, category).map(UnitToken::text).orElse("");
  }

  /**
   * Finds the first unit token together with the rank of the matcher that produced it.
   *
   * @param text matched slice; may be {@code null}
   * @param category category whose vocabulary applies; must not be {@code null}
   * @return token and rank (lower ranks take precedence), or empty
   */
  public static Optional<UnitToken> findUnit(String text, EntityCategory category) {
    Objects.requireNonNull(category, "category");
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    List<Pattern> matchers = MATCHERS.get(category);
    for (int rank = 0; rank < matchers.size(); rank++) {
      Matcher matcher = matchers.get(rank).matcher(text);
      if (matcher.find()) {
        return Optional.of(new UnitToken(canonicalize(matcher.group("u"), category), rank));
      }
    }
    return Optional.empty();
  }

  private static String canonicalize(String token, EntityCategory category) {
    String collapsed = WHITESPACE.matcher(token.strip()).replaceAll(" ");
    if (category == EntityCategory.TIME) {
      if (collapsed.toLowerCase(Locale.ROOT).startsWith("o")) {
        return "o'clock";
      }
      return collapsed.replace(".", "").toUpperCase(Locale.ROOT);
    }
    if (collapsed.startsWith("°")) {
      return collapsed.replace(" ", "");
    }
    return collapsed;
  }

  private static Map<EntityCategory, List<Pattern>> buildMatchers() {
    Map<EntityCategory, List<Pattern>> matchers = new EnumMap<>(EntityCategory.class);
    matchers.put(EntityCategory.DATE, List.of());
    matchers.put(EntityCategory.TIME, List.of(
        Pattern.compile(LEAD + "(?<u>(?i:[ap]\\.m\\.|[ap]m\\b))"),
        Pattern.compile("(?<u>(?i:o['’]clock))")));
    matchers.put(EntityCategory.MONEY, List.of(
        Pattern.compile("(?<u>[" + CURRENCY_SYMBOLS + "]|\\b(?:" + CURRENCY_CODES + ")\\b"
            + "|\\b(?i:" + MONEY_WORDS + ")\\b)"),
        Pattern.compile("\\b(?<u>(?i:" + SCALE_WORDS + "))\\b")));
    matchers.put(EntityCategory.MEASUREMENT, List.of(
        Pattern.compile("(?<u>" + PERCENT + ")"),
        Pattern.compile("(?<u>" + DEGREES + ")"),
        Pattern.compile(LEAD + "(?<u>(?i:" + MEASUREMENT_WORDS + "))\\b"),
        Pattern.compile(LEAD + "(?<u>" + MEASUREMENT_SYMBOLS + ")\\b")));
    return Map.copyOf(matchers);
  }

  /**
   * Unit token with the rank of the matcher that found it.
   *
   * @param text canonical unit text
   * @param rank matcher index; lower ranks are stronger evidence (currency before scale word)
   */
  public record UnitToken(String text, int rank) {}
}
