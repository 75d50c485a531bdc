package ca.gc.cra.facet.domain.lexicon;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Date fields as written, where {@code 0} marks a field the text left out.
 *
 * @param year four-digit year or {@code 0}
 * @param month month 1-12 or {@code 0}
 * @param day day of month or {@code 0}
 * @since FACET 0.1.0
 */
public record PartialDate(int year, int month, int day) {

  /**
   * Indicates whether the text named a day.
   *
   * @return {@code true} when {@code day} is present
   */
  public boolean hasDay() {
    return day != 0;
  }

  /**
   * Fills missing fields and validates the calendar date.
   *
   * <p>The year comes from this value, then {@code sharedYear}, then {@code sibling}; the month from this
   * value, then {@code sibling}. A missing day resolves to the first of the month.</p>
   *
   * @param sibling other bound of a range; may be {@code null}
   * @param sharedYear year written once for both bounds, or {@code 0}
   * @return calendar date, or empty when a field is still missing or the date does not exist
   */
  public Optional<LocalDate> resolve(PartialDate sibling, int sharedYear) {
    int y = year != 0 ? year : sharedYear != 0 ? sharedYear : sibling != null ? sibling.year : 0;
    int m = month != 0 ? month : sibling != null ? sibling.month : 0;
    int d = day != 0 ? day : 1;
    if (y < 1 || y > 9999 || m < 1 || m > 12) {
      return Optional.empty();
    }
    if (d > YearMonth.of(y, m).lengthOfMonth()) {
      return Optional.empty();
    }
    return Optional.of(LocalDate.of(y, m, d));
  }
}
