package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.application.patterns.CaptureRole;
import ca.gc.cra.facet.application.patterns.PatternDefinition;
import ca.gc.cra.facet.domain.entity.Entity;
import ca.gc.cra.facet.domain.entity.EntityCategory;
import ca.gc.cra.facet.domain.entity.RangeEntity;
import ca.gc.cra.facet.domain.entity.ScalarEntity;
import ca.gc.cra.facet.domain.entity.Span;
import ca.gc.cra.facet.domain.lexicon.ClockTime;
import ca.gc.cra.facet.domain.lexicon.DateLexicon;
import ca.gc.cra.facet.domain.lexicon.NumberLexicon;
import ca.gc.cra.facet.domain.lexicon.PartialDate;
import ca.gc.cra.facet.domain.lexicon.TimeLexicon;
import ca.gc.cra.facet.domain.lexicon.UnitLexicon;
import ca.gc.cra.facet.domain.lexicon.UnitLexicon.UnitToken;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;

/**
 * <strong>What:</strong> Turns a committed match into a typed {@link Entity}.
 * <p><strong>Why:</strong> Allocation only decides who owns a region; reading values, units, and calendar
 * fields out of the captured text is a separate concern with its own failure mode.</p>
 * <p><strong>Role:</strong> Invoked by {@link EntityExtractor} once per committed span, while the matcher still
 * points at the match.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read range bounds in textual order, sharing scale, meridiem, month, year, and unit between them.</li>
 *   <li>Force a negative value for MONEY and MEASUREMENT scalars produced by the negation tier.</li>
 *   <li>Report unreadable values as an empty result; a missing unit is an empty string.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since FACET 0.1.0
 */
final class EntityParser {

  /**
   * Parses the entity for {@code committed}.
   *
   * @param text full source text
   * @param committed committed span, UTF-16 offsets
   * @param match matcher positioned on the committed match
   * @return entity positioned on UTF-16 offsets, or empty when a value cannot be read
   */
  Optional<Entity> parse(String text, CommittedSpan committed, Matcher match) {
    PatternDefinition pattern = committed.pattern();
    Candidate candidate = new Candidate(pattern, match, new Span(committed.start(), committed.end()),
        text.substring(committed.start(), committed.end()));
    if (pattern.tier().isRange()) {
      return parseRange(candidate);
    }
    return parseScalar(candidate);
  }

  private Optional<Entity> parseRange(Candidate candidate) {
    String lo = candidate.capture(CaptureRole.LOW);
    String hi = candidate.capture(CaptureRole.HIGH);
    if (lo == null || hi == null || lo.isBlank() || hi.isBlank()) {
      return Optional.empty();
    }
    lo = lo.strip();
    hi = hi.strip();
    return switch (candidate.category()) {
      case DATE -> dateRange(candidate, lo, hi);
      case TIME -> timeRange(candidate, lo, hi);
      case MONEY, MEASUREMENT -> amountRange(candidate, lo, hi);
    };
  }

  private Optional<Entity> parseScalar(Candidate candidate) {
    String value = candidate.capture(CaptureRole.VALUE);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    value = value.strip();
    return switch (candidate.category()) {
      case DATE -> dateScalar(candidate, value);
      case TIME -> timeScalar(candidate, value);
      case MONEY, MEASUREMENT -> amountScalar(candidate, value);
    };
  }

  private Optional<Entity> dateRange(Candidate candidate, String lo, String hi) {
    Optional<PartialDate> first = DateLexicon.parse(lo);
    Optional<PartialDate> second = DateLexicon.parse(hi);
    if (first.isEmpty() || second.isEmpty()) {
      return Optional.empty();
    }
    int sharedYear = DateLexicon.parseYear(candidate.capture(CaptureRole.YEAR));
    Optional<LocalDate> start = first.get().resolve(second.get(), sharedYear);
    Optional<LocalDate> end = second.get().resolve(first.get(), sharedYear);
    if (start.isEmpty() || end.isEmpty()) {
      return Optional.empty();
    }
    boolean dayPrecision = first.get().hasDay() || second.get().hasDay();
    return Optional.of(new RangeEntity(EntityCategory.DATE,
        start.get().toEpochDay(), end.get().toEpochDay(), "", "", lo, hi,
        dateText(start.get(), dayPrecision), dateText(end.get(), dayPrecision),
        candidate.span(), candidate.rawText(), candidate.patternName(), candidate.tierRank()));
  }

  private Optional<Entity> timeRange(Candidate candidate, String lo, String hi) {
    Optional<ClockTime> first = TimeLexicon.parse(lo);
    Optional<ClockTime> second = TimeLexicon.parse(hi);
    if (first.isEmpty() || second.isEmpty()) {
      return Optional.empty();
    }
    ClockTime startClock = first.get().inheritMeridiem(second.get(), true);
    ClockTime endClock = second.get().inheritMeridiem(first.get(), false);
    Optional<LocalTime> start = startClock.toLocalTime();
    Optional<LocalTime> end = endClock.toLocalTime();
    if (start.isEmpty() || end.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new RangeEntity(EntityCategory.TIME,
        start.get().toSecondOfDay(), end.get().toSecondOfDay(), timeUnit(startClock, lo), timeUnit(endClock, hi),
        lo, hi, start.get().toString(), end.get().toString(),
        candidate.span(), candidate.rawText(), candidate.patternName(), candidate.tierRank()));
  }

  private Optional<Entity> amountRange(Candidate candidate, String lo, String hi) {
    OptionalDouble loMantissa = NumberLexicon.parseMantissa(lo);
    OptionalDouble hiMantissa = NumberLexicon.parseMantissa(hi);
    if (loMantissa.isEmpty() || hiMantissa.isEmpty()) {
      return Optional.empty();
    }
    boolean scaled = candidate.category() == EntityCategory.MONEY;
    double loScale = scaled ? NumberLexicon.scaleOf(lo) : 1.0;
    double hiScale = scaled ? NumberLexicon.scaleOf(hi) : 1.0;
    double loAbs = Math.abs(loMantissa.getAsDouble());
    double hiAbs = Math.abs(hiMantissa.getAsDouble());
    // "$1-5 million" shares the scale; "$500 to $2 million" does not.
    if (loScale == 1.0 && hiScale != 1.0 && loAbs <= hiAbs) {
      loScale = hiScale;
    } else if (hiScale == 1.0 && loScale != 1.0 && hiAbs <= loAbs) {
      hiScale = loScale;
    }
    OptionalDouble start = NumberLexicon.finite(loMantissa.getAsDouble() * loScale);
    OptionalDouble end = NumberLexicon.finite(hiMantissa.getAsDouble() * hiScale);
    if (start.isEmpty() || end.isEmpty()) {
      return Optional.empty();
    }
    String[] units = rangeUnits(candidate, lo, hi);
    return Optional.of(new RangeEntity(candidate.category(), start.getAsDouble(), end.getAsDouble(), units[0],
        units[1], lo, hi, NumberLexicon.format(start.getAsDouble()), NumberLexicon.format(end.getAsDouble()),
        candidate.span(), candidate.rawText(), candidate.patternName(), candidate.tierRank()));
  }

  private Optional<Entity> dateScalar(Candidate candidate, String value) {
    Optional<PartialDate> parsed = DateLexicon.parse(value);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    Optional<LocalDate> date = parsed.get().resolve(null, 0);
    if (date.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ScalarEntity(EntityCategory.DATE, date.get().toEpochDay(), "",
        dateText(date.get(), parsed.get().hasDay()), candidate.span(), candidate.rawText(),
        candidate.patternName(), candidate.tierRank(), false));
  }

  private Optional<Entity> timeScalar(Candidate candidate, String value) {
    Optional<ClockTime> clock = TimeLexicon.parse(value);
    if (clock.isEmpty()) {
      return Optional.empty();
    }
    Optional<LocalTime> time = clock.get().toLocalTime();
    if (time.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ScalarEntity(EntityCategory.TIME, time.get().toSecondOfDay(),
        timeUnit(clock.get(), value), time.get().toString(), candidate.span(), candidate.rawText(),
        candidate.patternName(), candidate.tierRank(), false));
  }

  private Optional<Entity> amountScalar(Candidate candidate, String value) {
    OptionalDouble parsed = candidate.category() == EntityCategory.MONEY
        ? NumberLexicon.parseNumber(value)
        : NumberLexicon.parseMantissa(value);
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    boolean negated = candidate.pattern().tier().isNegative();
    double amount = negated ? -Math.abs(parsed.getAsDouble()) : parsed.getAsDouble();
    return Optional.of(new ScalarEntity(candidate.category(), amount, scalarUnit(candidate, value),
        NumberLexicon.format(amount), candidate.span(), candidate.rawText(),
        candidate.patternName(), candidate.tierRank(), negated));
  }

  /** Returns {start unit, end unit}. */
  private String[] rangeUnits(Candidate candidate, String lo, String hi) {
    EntityCategory category = candidate.category();
    String shared = candidate.capture(CaptureRole.UNIT);
    if (shared != null && !shared.isBlank()) {
      String unit = canonicalUnit(shared, category);
      return new String[] {unit, unit};
    }
    Optional<UnitToken> first = boundUnit(candidate, CaptureRole.LOW_UNIT, lo);
    Optional<UnitToken> second = boundUnit(candidate, CaptureRole.HIGH_UNIT, hi);
    if (first.isEmpty() && second.isEmpty()) {
      String unit = UnitLexicon.parseUnit(candidate.rawText(), category);
      return new String[] {unit, unit};
    }
    if (first.isEmpty()) {
      return new String[] {second.get().text(), second.get().text()};
    }
    if (second.isEmpty()) {
      return new String[] {first.get().text(), first.get().text()};
    }
    if (first.get().rank() != second.get().rank()) {
      UnitToken stronger = first.get().rank() < second.get().rank() ? first.get() : second.get();
      return new String[] {stronger.text(), stronger.text()};
    }
    return new String[] {first.get().text(), second.get().text()};
  }

  private Optional<UnitToken> boundUnit(Candidate candidate, CaptureRole role, String boundText) {
    String captured = candidate.capture(role);
    String source = captured == null || captured.isBlank() ? boundText : captured;
    return UnitLexicon.findUnit(source, candidate.category());
  }

  private String scalarUnit(Candidate candidate, String value) {
    String captured = candidate.capture(CaptureRole.UNIT);
    if (captured != null && !captured.isBlank()) {
      return canonicalUnit(captured, candidate.category());
    }
    Optional<UnitToken> token = UnitLexicon.findUnit(value, candidate.category());
    if (token.isPresent()) {
      return token.get().text();
    }
    return UnitLexicon.parseUnit(candidate.rawText(), candidate.category());
  }

  private static String canonicalUnit(String token, EntityCategory category) {
    String unit = UnitLexicon.parseUnit(token, category);
    return unit.isEmpty() ? token.strip() : unit;
  }

  private static String timeUnit(ClockTime clock, String text) {
    if (clock.meridiem() != ClockTime.Meridiem.NONE) {
      return clock.meridiem().name();
    }
    return UnitLexicon.parseUnit(text, EntityCategory.TIME);
  }

  private static String dateText(LocalDate date, boolean dayPrecision) {
    return dayPrecision ? date.toString() : YearMonth.from(date).toString();
  }

  private record Candidate(PatternDefinition pattern, Matcher match, Span span, String rawText) {
    String capture(CaptureRole role) {
      return pattern.capture(match, role);
    }

    EntityCategory category() {
      return pattern.category();
    }

    String patternName() {
      return pattern.name();
    }

    int tierRank() {
      return pattern.tier().rank();
    }
  }
}
