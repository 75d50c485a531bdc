package ca.gc.cra.facet.domain.lexicon;

import ca.gc.cra.facet.domain.lexicon.ClockTime.Meridiem;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code H:MM[:SS][ AM|PM]}, {@code H AM|PM}, {@code H o'clock}, and a bare hour into
 * {@link ClockTime} values.
 *
 * @since FACET 0.1.0
 */
public final class TimeLexicon {
  /** Meridiem alternation used by the pattern fragments. */
  public static final String MERIDIEM_PATTERN = "(?:[AaPp]\\.[Mm]\\.|[AaPp][Mm]\\b)";

  private static final String MERIDIEM = "(?:([ap])\\.m\\.|([ap])m)";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE;
  private static final Pattern CLOCK =
      Pattern.compile("(\\d{1,2}):(\\d{2})(?::(\\d{2}))?\\s?" + MERIDIEM + "?", FLAGS);
  private static final Pattern HOUR_MERIDIEM = Pattern.compile("(\\d{1,2})\\s?" + MERIDIEM, FLAGS);
  private static final Pattern OCLOCK = Pattern.compile("(\\d{1,2})\\s?o['’]clock", FLAGS);
  private static final Pattern HOUR = Pattern.compile("(\\d{1,2})");

  private TimeLexicon() {
    // Utility
  }

  /**
   * Parses a time slice without range validation.
   *
   * @param text matched slice; may be {@code null}
   * @return clock reading, or empty when the slice has no supported shape
   */
  public static Optional<ClockTime> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String trimmed = text.strip();
    Matcher m = CLOCK.matcher(trimmed);
    if (m.matches()) {
      int second = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
      return Optional.of(new ClockTime(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), second,
          meridiem(m.group(4), m.group(5))));
    }
    m = HOUR_MERIDIEM.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new ClockTime(Integer.parseInt(m.group(1)), 0, 0, meridiem(m.group(2), m.group(3))));
    }
    m = OCLOCK.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new ClockTime(Integer.parseInt(m.group(1)), 0, 0, Meridiem.NONE));
    }
    m = HOUR.matcher(trimmed);
    if (m.matches()) {
      return Optional.of(new ClockTime(Integer.parseInt(m.group(1)), 0, 0, Meridiem.NONE));
    }
    return Optional.empty();
  }

  private static Meridiem meridiem(String dotted, String plain) {
    String letter = dotted != null ? dotted : plain;
    if (letter == null) {
      return Meridiem.NONE;
    }
    return Character.toLowerCase(letter.charAt(0)) == 'a' ? Meridiem.AM : Meridiem.PM;
  }
}
