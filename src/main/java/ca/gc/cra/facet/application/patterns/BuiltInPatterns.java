package ca.gc.cra.facet.application.patterns;

import static ca.gc.cra.facet.application.patterns.PatternFragments.AMOUNT;
import static ca.gc.cra.facet.application.patterns.PatternFragments.CONTEXT_JOIN;
import static ca.gc.cra.facet.application.patterns.PatternFragments.CURRENCY;
import static ca.gc.cra.facet.application.patterns.PatternFragments.DAY;
import static ca.gc.cra.facet.application.patterns.PatternFragments.DAY_MONTH;
import static ca.gc.cra.facet.application.patterns.PatternFragments.FULL_DATE;
import static ca.gc.cra.facet.application.patterns.PatternFragments.GAP;
import static ca.gc.cra.facet.application.patterns.PatternFragments.ISO_DATE;
import static ca.gc.cra.facet.application.patterns.PatternFragments.JOIN;
import static ca.gc.cra.facet.application.patterns.PatternFragments.MONEY_BOUND;
import static ca.gc.cra.facet.application.patterns.PatternFragments.MONEY_SECOND_BOUND;
import static ca.gc.cra.facet.application.patterns.PatternFragments.MONEY_WORD;
import static ca.gc.cra.facet.application.patterns.PatternFragments.MONTH;
import static ca.gc.cra.facet.application.patterns.PatternFragments.MONTH_DAY;
import static ca.gc.cra.facet.application.patterns.PatternFragments.NEGATION_CUE;
import static ca.gc.cra.facet.application.patterns.PatternFragments.NEGATION_GUARD;
import static ca.gc.cra.facet.application.patterns.PatternFragments.NUM;
import static ca.gc.cra.facet.application.patterns.PatternFragments.OCLOCK;
import static ca.gc.cra.facet.application.patterns.PatternFragments.SCALE;
import static ca.gc.cra.facet.application.patterns.PatternFragments.SCALED_NUM;
import static ca.gc.cra.facet.application.patterns.PatternFragments.SIGN;
import static ca.gc.cra.facet.application.patterns.PatternFragments.SIGNED_NUM;
import static ca.gc.cra.facet.application.patterns.PatternFragments.TIME;
import static ca.gc.cra.facet.application.patterns.PatternFragments.TIME_START;
import static ca.gc.cra.facet.application.patterns.PatternFragments.UNIT;
import static ca.gc.cra.facet.application.patterns.PatternFragments.US_DATE;
import static ca.gc.cra.facet.application.patterns.PatternFragments.YEAR;
import static ca.gc.cra.facet.application.patterns.PatternFragments.YEAR_GAP;
import static ca.gc.cra.facet.application.patterns.PatternFragments.cue;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.ArrayList;
import java.util.List;

/**
 * The built-in tier table.
 *
 * <pre>
 * Tier | DATE                          | TIME             | MONEY                           | MEASUREMENT
 * 1    | cue + date range              | cue + time range | cue + money range               | cue + measurement range
 * 2    | full, cross/same month, ISO, US | 9:00 AM-5:00 PM | $1-5 million, 10 to 20 dollars  | 10-15%, -20°F to 120°F
 * 3    | March 15, 2024, ISO, US       | 9:30 AM, 14:45   | $1,234.56 (negation guarded)    | -
 * 4    | -                             | -                | loss of $500, -$500, $-500      | -20°F, below -37 inches
 * 5    | March 2024                    | 9 o'clock        | 500 dollars, 10K USD            | 15%, 250 pounds
 * </pre>
 *
 * <p>Sources are declared category by category; the library's stable tier sort then yields the order DATE,
 * TIME, MONEY, MEASUREMENT inside every tier. Context ranges reuse the bare-range bodies behind a cue, with
 * {@code and} added to the joining operators.</p>
 *
 * @since FACET 0.1.0
 */
public final class BuiltInPatterns {

  private BuiltInPatterns() {
    // Constants
  }

  /**
   * Returns every built-in source in declaration order.
   *
   * @return immutable list of sources
   */
  public static List<PatternSource> sources() {
    List<PatternSource> sources = new ArrayList<>();
    sources.addAll(dates());
    sources.addAll(times());
    sources.addAll(money());
    sources.addAll(measurements());
    return List.copyOf(sources);
  }

  private static List<PatternSource> dates() {
    List<PatternSource> sources = new ArrayList<>();
    String cue = cue("period");
    for (String[] body : dateRangeBodies(CONTEXT_JOIN)) {
      sources.add(date("date.context." + body[0], Tier.CONTEXT_RANGE, cue + body[1]));
    }
    for (String[] body : dateRangeBodies(JOIN)) {
      sources.add(date("date.range." + body[0], Tier.BARE_RANGE, body[1]));
    }
    sources.add(date("date.full", Tier.COMPLETE_SINGLE, "\\b(?<value>" + FULL_DATE + ")"));
    sources.add(date("date.iso", Tier.COMPLETE_SINGLE, "\\b(?<value>" + ISO_DATE + ")"));
    sources.add(date("date.us", Tier.COMPLETE_SINGLE, "\\b(?<value>" + US_DATE + ")"));
    sources.add(date("date.monthYear", Tier.BARE_SCALAR, "\\b(?<value>" + MONTH + YEAR_GAP + YEAR + ")"));
    return sources;
  }

  private static List<String[]> dateRangeBodies(String join) {
    return List.of(
        new String[] {"full", "\\b(?<lo>" + FULL_DATE + ")" + join + "(?<hi>" + FULL_DATE + ")"},
        new String[] {"crossMonth", "\\b(?<lo>" + MONTH_DAY + ")" + join + "(?<hi>" + MONTH_DAY + ")" + YEAR_GAP
            + "(?<year>" + YEAR + ")"},
        new String[] {"sameMonth", "\\b(?<lo>" + MONTH_DAY + ")" + join + "(?<hi>" + DAY + ")" + YEAR_GAP
            + "(?<year>" + YEAR + ")"},
        new String[] {"dayFirst", "\\b(?<lo>" + DAY + ")" + join + "(?<hi>" + DAY_MONTH + ")" + YEAR_GAP
            + "(?<year>" + YEAR + ")"},
        new String[] {"iso", "\\b(?<lo>" + ISO_DATE + ")" + join + "(?<hi>" + ISO_DATE + ")"},
        new String[] {"us", "\\b(?<lo>" + US_DATE + ")" + join + "(?<hi>" + US_DATE + ")"});
  }

  private static List<PatternSource> times() {
    return List.of(
        time("time.context", Tier.CONTEXT_RANGE,
            cue("hours") + "(?<lo>" + TIME_START + ")" + CONTEXT_JOIN + "(?<hi>" + TIME + ")"),
        time("time.range", Tier.BARE_RANGE, "\\b(?<lo>" + TIME_START + ")" + JOIN + "(?<hi>" + TIME + ")"),
        time("time.clock", Tier.COMPLETE_SINGLE, "\\b(?<value>" + TIME + ")"),
        time("time.oclock", Tier.BARE_SCALAR, "\\b(?<value>" + OCLOCK + ")"));
  }

  private static List<PatternSource> money() {
    String cue = cue("");
    return List.of(
        money("money.context.currency", Tier.CONTEXT_RANGE,
            cue + "(?<lo>" + MONEY_BOUND + ")" + CONTEXT_JOIN + "(?<hi>" + MONEY_SECOND_BOUND + ")"),
        money("money.context.words", Tier.CONTEXT_RANGE,
            cue + "(?<lo>" + SCALED_NUM + ")" + CONTEXT_JOIN + "(?<hi>" + SCALED_NUM + ")" + GAP + "(?<unit>"
                + MONEY_WORD + ")"),
        money("money.range.currency", Tier.BARE_RANGE,
            "(?<lo>" + MONEY_BOUND + ")" + JOIN + "(?<hi>" + MONEY_SECOND_BOUND + ")"),
        money("money.range.words", Tier.BARE_RANGE,
            "(?<lo>" + SCALED_NUM + ")" + JOIN + "(?<hi>" + SCALED_NUM + ")" + GAP + "(?<unit>" + MONEY_WORD + ")"),
        money("money.amount", Tier.COMPLETE_SINGLE, "(?<value>" + AMOUNT + ")").withGuard(NEGATION_GUARD),
        money("money.negative.cue", Tier.NEGATIVE_SCALAR,
            NEGATION_CUE + "(?<value>" + CURRENCY + "\\s?(?:[-−]\\s?)?" + NUM + SCALE + "?)"),
        money("money.negative.words", Tier.NEGATIVE_SCALAR,
            NEGATION_CUE + "(?<value>" + NUM + SCALE + "?)" + GAP + "(?<unit>" + MONEY_WORD + ")"),
        money("money.negative.sign", Tier.NEGATIVE_SCALAR, "\\B" + SIGN + "\\s?(?<value>" + AMOUNT + ")"),
        money("money.negative.inner", Tier.NEGATIVE_SCALAR,
            "(?<value>" + CURRENCY + "\\s?" + SIGN + "\\s?" + NUM + SCALE + "?)"),
        money("money.words", Tier.BARE_SCALAR,
            "\\b(?<value>" + NUM + SCALE + "?)" + GAP + "(?<unit>" + MONEY_WORD + ")"));
  }

  private static List<PatternSource> measurements() {
    String rangeBody = "(?<lo>" + SIGNED_NUM + ")(?:" + GAP + "(?<loUnit>" + UNIT + "))?{join}(?<hi>" + SIGNED_NUM
        + ")" + GAP + "(?<hiUnit>" + UNIT + ")";
    return List.of(
        measurement("measurement.context", Tier.CONTEXT_RANGE, cue("") + rangeBody.replace("{join}", CONTEXT_JOIN)),
        measurement("measurement.range", Tier.BARE_RANGE, rangeBody.replace("{join}", JOIN)),
        measurement("measurement.negative.cue", Tier.NEGATIVE_SCALAR,
            NEGATION_CUE + "(?<value>" + NUM + ")" + GAP + "(?<unit>" + UNIT + ")"),
        measurement("measurement.negative.sign", Tier.NEGATIVE_SCALAR,
            "\\B" + SIGN + "\\s?(?<value>" + NUM + ")" + GAP + "(?<unit>" + UNIT + ")"),
        measurement("measurement.value", Tier.BARE_SCALAR, "\\b(?<value>" + NUM + ")" + GAP + "(?<unit>" + UNIT + ")"));
  }

  private static PatternSource date(String name, Tier tier, String regex) {
    return PatternSource.of(name, EntityCategory.DATE, tier, regex);
  }

  private static PatternSource time(String name, Tier tier, String regex) {
    return PatternSource.of(name, EntityCategory.TIME, tier, regex);
  }

  private static PatternSource money(String name, Tier tier, String regex) {
    return PatternSource.of(name, EntityCategory.MONEY, tier, regex);
  }

  private static PatternSource measurement(String name, Tier tier, String regex) {
    return PatternSource.of(name, EntityCategory.MEASUREMENT, tier, regex);
  }
}
