package ca.gc.cra.facet.domain.lexicon;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Clock reading as written, before conversion to a 24-hour time.
 *
 * @param hour hour as written
 * @param minute minute, {@code 0} when omitted
 * @param second second, {@code 0} when omitted
 * @param meridiem AM/PM marker, {@link Meridiem#NONE} when omitted
 * @since FACET 0.1.0
 */
public record ClockTime(int hour, int minute, int second, Meridiem meridiem) {

  /** Meridiem marker. */
  public enum Meridiem {
    NONE,
    AM,
    PM;

    Meridiem opposite() {
      return switch (this) {
        case AM -> PM;
        case PM -> AM;
        case NONE -> NONE;
      };
    }
  }

  public ClockTime {
    meridiem = meridiem == null ? Meridiem.NONE : meridiem;
  }

  /**
   * Converts to a 24-hour time, validating every field.
   *
   * @return time of day, or empty when a field is out of range
   */
  public Optional<LocalTime> toLocalTime() {
    if (minute < 0 || minute > 59 || second < 0 || second > 59) {
      return Optional.empty();
    }
    if (meridiem == Meridiem.NONE) {
      if (hour < 0 || hour > 23) {
        return Optional.empty();
      }
      return Optional.of(LocalTime.of(hour, minute, second));
    }
    if (hour < 1 || hour > 12) {
      return Optional.empty();
    }
    int h24 = hour % 12 + (meridiem == Meridiem.PM ? 12 : 0);
    return Optional.of(LocalTime.of(h24, minute, second));
  }

  /**
   * Returns a copy carrying {@code value} as meridiem.
   *
   * @param value replacement meridiem
   * @return adjusted clock time
   */
  public ClockTime withMeridiem(Meridiem value) {
    return new ClockTime(hour, minute, second, value);
  }

  /**
   * Borrows the meridiem of the other bound of a range when this bound has none, as in {@code 2:30-4:00 PM}.
   *
   * <p>When the borrowed meridiem would put a start bound after its end (or an end bound before its start),
   * the opposite meridiem is used instead, so {@code 10:00-2:00 PM} reads as 10:00 to 14:00.</p>
   *
   * @param other the other bound; must not be {@code null}
   * @param isStart whether this value is the start bound
   * @return this value, or a copy with an inherited meridiem
   */
  public ClockTime inheritMeridiem(ClockTime other, boolean isStart) {
    if (meridiem != Meridiem.NONE || other.meridiem == Meridiem.NONE || hour < 1 || hour > 12) {
      return this;
    }
    ClockTime candidate = withMeridiem(other.meridiem);
    Optional<LocalTime> mine = candidate.toLocalTime();
    Optional<LocalTime> theirs = other.toLocalTime();
    if (mine.isEmpty() || theirs.isEmpty()) {
      return candidate;
    }
    boolean inverted = isStart ? mine.get().isAfter(theirs.get()) : mine.get().isBefore(theirs.get());
    return inverted ? withMeridiem(other.meridiem.opposite()) : candidate;
  }
}
