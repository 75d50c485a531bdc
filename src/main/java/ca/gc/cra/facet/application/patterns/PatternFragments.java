package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.lexicon.DateLexicon;
import ca.gc.cra.facet.domain.lexicon.TimeLexicon;
import ca.gc.cra.facet.domain.lexicon.UnitLexicon;

/**
 * Regex building blocks shared by the built-in patterns. Fragments carry no capturing groups.
 *
 * <p>Word vocabularies use inline {@code (?i:...)} so single-letter unit symbols such as {@code m} and
 * {@code V} stay case-sensitive. Leading signs use {@code \B} so a dash glued to a preceding word is not read
 * as a minus.</p>
 *
 * <p>Every repetition is bounded so each match attempt does a fixed amount of work. Numbers carry at most
 * {@code 15} integer digits (or six thousands groups) and {@code 12} decimals; whitespace gaps are at most three
 * characters.</p>
 *
 * @since FACET 0.1.0
 */
final class PatternFragments {
  static final String GAP = "\\s{0,3}";
  static final String SPACE = "\\s{1,3}";

  static final String SIGN = "[-−–—]";
  static final String LEADING_SIGN = "(?:\\B" + SIGN + "\\s?)";

  static final String NUM = "(?:\\d{1,3}(?:,\\d{3}){1,6}(?:\\.\\d{1,12})?|\\d{1,15}(?:\\.\\d{1,12})?)";
  static final String SIGNED_NUM = LEADING_SIGN + "?\\b" + NUM;
  static final String SCALE = "(?:\\s?(?i:" + UnitLexicon.SCALE_WORDS + ")\\b|[KkMmBbT]\\b)";

  static final String CURRENCY = "(?:[" + UnitLexicon.CURRENCY_SYMBOLS + "]|\\b(?:"
      + UnitLexicon.CURRENCY_CODES + ")\\s?)";
  static final String MONEY_WORD = UnitLexicon.MONEY_WORD_PATTERN;
  static final String AMOUNT = CURRENCY + "\\s?" + NUM + SCALE + "?";
  static final String MONEY_BOUND = LEADING_SIGN + "?" + CURRENCY + "\\s?(?:[-−]\\s?)?" + NUM + SCALE + "?";
  static final String MONEY_SECOND_BOUND =
      LEADING_SIGN + "?(?:" + CURRENCY + "\\s?)?(?:[-−]\\s?)?\\b" + NUM + SCALE + "?";
  static final String SCALED_NUM = SIGNED_NUM + SCALE + "?";

  static final String UNIT = UnitLexicon.MEASUREMENT_UNIT_PATTERN;

  static final String JOIN = join("to|through|thru");
  static final String CONTEXT_JOIN = join("to|through|thru|and");

  static final String NEGATION_WORDS = "minus|negative|(?:loss|decline|drop|deficit)" + SPACE + "of|below";
  static final String NEGATION_CUE = "\\b(?i:" + NEGATION_WORDS + ")" + GAP + "(?:" + SIGN + "\\s?)?";
  /** Guard matching a negation cue or a free-standing sign at the end of the preceding text. */
  static final String NEGATION_GUARD = "(?:\\B" + SIGN + "\\s?|\\b(?i:" + NEGATION_WORDS + ")" + GAP + ")$";

  static final String MERIDIEM = TimeLexicon.MERIDIEM_PATTERN;
  static final String CLOCK = "\\d{1,2}:\\d{2}(?::\\d{2})?(?:\\s?" + MERIDIEM + ")?";
  static final String TIME = "(?:" + CLOCK + "|\\d{1,2}\\s?" + MERIDIEM + ")";
  static final String TIME_START = "(?:\\d{1,2}(?::\\d{2}(?::\\d{2})?)?(?:\\s?" + MERIDIEM + ")?)";
  static final String OCLOCK = "\\d{1,2}\\s?(?i:o['’]clock)";

  static final String MONTH = DateLexicon.MONTH_PATTERN;
  static final String DAY = "\\d{1,2}(?i:st|nd|rd|th)?\\b";
  static final String YEAR = "\\d{4}\\b";
  static final String MONTH_DAY = MONTH + SPACE + DAY;
  static final String DAY_MONTH = DAY + SPACE + MONTH;
  static final String YEAR_GAP = ",?" + SPACE;
  static final String FULL_DATE =
      "(?:" + MONTH_DAY + YEAR_GAP + YEAR + "|" + DAY_MONTH + YEAR_GAP + YEAR + ")";
  static final String ISO_DATE = "\\d{4}-\\d{2}-\\d{2}";
  static final String US_DATE = "\\d{1,2}/\\d{1,2}/\\d{4}\\b";

  private PatternFragments() {
    // Constants
  }

  private static String join(String words) {
    return "(?:" + GAP + SIGN + GAP + "|" + SPACE + "(?i:" + words + ")" + SPACE + "|" + GAP + "/" + GAP + ")";
  }

  /**
   * Cue words that open a context range, followed by an optional colon and connector.
   *
   * @param extraWords additional category-specific cue words, {@code |}-separated; may be empty
   * @return cue fragment consuming trailing whitespace
   */
  static String cue(String extraWords) {
    String words = "range|ranging|ranges|from|between|budget|budgeted"
        + (extraWords.isEmpty() ? "" : "|" + extraWords);
    return "\\b(?i:" + words + ")\\b(?:" + GAP + ":)?(?:" + SPACE + "(?i:of|from|between))?" + GAP;
  }
}
