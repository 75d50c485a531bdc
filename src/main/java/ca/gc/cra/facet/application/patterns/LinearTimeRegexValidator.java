package ca.gc.cra.facet.application.patterns;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that a regex stays inside a bounded-repetition subset whose unanchored search runs in time linear in the
 * text length.
 *
 * <p>Every attempt at a start offset must do a bounded amount of work, so the following are rejected:
 * backreferences ({@code \1}, {@code \k<name>}), lookahead and lookbehind, atomic groups, possessive quantifiers,
 * unbounded quantifiers ({@code *}, {@code +}, {@code {n,}}), repetition bounds above {@value #MAX_REPETITION},
 * a group repeated more than once that holds a variable-width quantifier (such as {@code (a{1,9}){1,9}}), and two
 * adjacent variable-width atoms that can match the same character (such as {@code \d{0,9}\d{0,9}}).</p>
 *
 * <p>The scan is syntactic. Malformed input is left for {@link java.util.regex.Pattern#compile(String)} to
 * report.</p>
 *
 * @since FACET 0.1.0
 */
final class LinearTimeRegexValidator {
  static final int MAX_REPETITION = 100;

  /**
   * Scans {@code regex} for constructs outside the bounded-repetition subset.
   *
   * @param regex pattern text; must not be {@code null}
   * @return reason for the first violation, or empty when the pattern is acceptable
   */
  Optional<String> check(String regex) {
    return new Scan(regex).run();
  }

  /** Coarse character kinds; {@code SYMBOL} stands for any punctuation character. */
  private enum Kind {
    DIGIT, LETTER, SPACE, SYMBOL
  }

  private static final class Scan {
    private final String regex;
    /** Per open group: whether it holds a variable-width quantifier. */
    private final Deque<boolean[]> groups = new ArrayDeque<>();
    private Atom previousVariable;
    private int pos;

    private Scan(String regex) {
      this.regex = regex;
    }

    Optional<String> run() {
      groups.push(new boolean[] {false});
      while (pos < regex.length()) {
        char c = regex.charAt(pos);
        Optional<String> violation;
        if (c == '\\') {
          violation = escape();
        } else if (c == '[') {
          int start = pos;
          pos = skipClass(pos);
          violation = atomQuantifier(classAtom(start, pos));
        } else if (c == '(') {
          violation = openGroup();
        } else if (c == ')') {
          violation = closeGroup();
        } else if (c == '|') {
          pos++;
          previousVariable = null;
          violation = Optional.empty();
        } else {
          pos++;
          violation = atomQuantifier(c == '.' ? Atom.ANY : Atom.literal(c));
        }
        if (violation.isPresent()) {
          return violation;
        }
      }
      return Optional.empty();
    }

    private Optional<String> escape() {
      if (pos + 1 >= regex.length()) {
        pos++;
        return Optional.empty();
      }
      char next = regex.charAt(pos + 1);
      if (next >= '1' && next <= '9') {
        return Optional.of("backreference \\" + next + " is not allowed");
      }
      if (next == 'k') {
        return Optional.of("named backreference is not allowed");
      }
      if (next == 'Q') {
        int end = regex.indexOf("\\E", pos + 2);
        pos = end < 0 ? regex.length() : end + 2;
        return atomQuantifier(Atom.ANY);
      }
      pos += 2;
      return atomQuantifier(escapeAtom(next));
    }

    private Optional<String> openGroup() {
      if (regex.startsWith("(?=", pos) || regex.startsWith("(?!", pos)) {
        return Optional.of("lookahead is not allowed");
      }
      if (regex.startsWith("(?<=", pos) || regex.startsWith("(?<!", pos)) {
        return Optional.of("lookbehind is not allowed");
      }
      if (regex.startsWith("(?>", pos)) {
        return Optional.of("atomic groups are not allowed");
      }
      groups.push(new boolean[] {false});
      previousVariable = null;
      pos++;
      return Optional.empty();
    }

    private Optional<String> closeGroup() {
      pos++;
      previousVariable = null;
      if (groups.size() == 1) {
        return Optional.empty();
      }
      boolean innerVariable = groups.pop()[0];
      Quantifier quantifier = readQuantifier();
      if (quantifier.violation != null) {
        return Optional.of(quantifier.violation);
      }
      if (quantifier.max > 1 && innerVariable) {
        return Optional.of("repeated group holds a variable-width quantifier near offset " + pos);
      }
      if (quantifier.variable() || innerVariable) {
        groups.peek()[0] = true;
      }
      return Optional.empty();
    }

    private Optional<String> atomQuantifier(Atom atom) {
      Quantifier quantifier = readQuantifier();
      if (quantifier.violation != null) {
        return Optional.of(quantifier.violation);
      }
      if (!quantifier.variable()) {
        previousVariable = null;
        return Optional.empty();
      }
      groups.peek()[0] = true;
      if (previousVariable != null && previousVariable.overlaps(atom)) {
        return Optional.of("adjacent variable-width quantifiers overlap near offset " + pos);
      }
      previousVariable = atom;
      return Optional.empty();
    }

    private Quantifier readQuantifier() {
      if (pos >= regex.length()) {
        return Quantifier.ONCE;
      }
      int start = pos;
      char c = regex.charAt(pos);
      int min;
      int max;
      if (c == '*' || c == '+') {
        return new Quantifier(0, 0, "unbounded quantifier '" + c + "' near offset " + pos
            + "; use a bounded repetition such as {1," + MAX_REPETITION + "}");
      } else if (c == '?') {
        min = 0;
        max = 1;
        pos++;
      } else if (c == '{') {
        int close = regex.indexOf('}', pos);
        if (close < 0) {
          return Quantifier.ONCE;
        }
        String body = regex.substring(pos + 1, close);
        if (!body.matches("\\d+(?:,\\d*)?")) {
          return Quantifier.ONCE;
        }
        String[] bounds = body.split(",", -1);
        if (bounds.length == 2 && bounds[1].isEmpty()) {
          return new Quantifier(0, 0, "unbounded quantifier {" + body + "} near offset " + start);
        }
        for (String bound : bounds) {
          if (bound.length() > 4 || Integer.parseInt(bound) > MAX_REPETITION) {
            return new Quantifier(0, 0, "repetition bound {" + body + "} exceeds " + MAX_REPETITION);
          }
        }
        min = Integer.parseInt(bounds[0]);
        max = Integer.parseInt(bounds[bounds.length - 1]);
        pos = close + 1;
      } else {
        return Quantifier.ONCE;
      }
      if (pos < regex.length()) {
        char modifier = regex.charAt(pos);
        if (modifier == '+') {
          return new Quantifier(min, max, "possessive quantifiers are not allowed");
        }
        if (modifier == '?') {
          pos++;
        }
      }
      return new Quantifier(min, max, null);
    }

    private int skipClass(int start) {
      int i = start + 1;
      if (i < regex.length() && regex.charAt(i) == '^') {
        i++;
      }
      if (i < regex.length() && regex.charAt(i) == ']') {
        i++;
      }
      int depth = 1;
      while (i < regex.length()) {
        char c = regex.charAt(i);
        if (c == '\\') {
          i += 2;
          continue;
        }
        if (c == '[') {
          depth++;
        } else if (c == ']') {
          depth--;
          if (depth == 0) {
            return i + 1;
          }
        }
        i++;
      }
      return regex.length();
    }

    private Atom classAtom(int start, int end) {
      if (start + 1 < regex.length() && regex.charAt(start + 1) == '^') {
        return Atom.ANY;
      }
      Set<Kind> kinds = EnumSet.noneOf(Kind.class);
      Set<Character> symbols = new HashSet<>();
      int i = start + 1;
      int last = Math.max(i, end - 1);
      while (i < last) {
        Atom member;
        if (regex.charAt(i) == '\\' && i + 1 < last) {
          member = escapeAtom(regex.charAt(i + 1));
          i += 2;
        } else {
          member = Atom.literal(regex.charAt(i));
          i++;
        }
        kinds.addAll(member.kinds());
        symbols.addAll(member.symbols());
      }
      return new Atom(kinds, symbols);
    }

    private static Atom escapeAtom(char escaped) {
      return switch (escaped) {
        case 'd' -> Atom.of(Kind.DIGIT);
        case 'w' -> Atom.of(Kind.DIGIT, Kind.LETTER, Kind.SYMBOL);
        case 's', 'h', 'v', 'R' -> Atom.of(Kind.SPACE);
        case 'D', 'W', 'S', 'p', 'P', 'X', 'N' -> Atom.ANY;
        default -> Character.isLetter(escaped) ? Atom.of(Kind.SPACE, Kind.SYMBOL) : Atom.literal(escaped);
      };
    }
  }

  /**
   * Characters an atom can consume: whole kinds plus individual punctuation characters.
   *
   * @param kinds kinds matched in full
   * @param symbols punctuation characters matched individually
   */
  private record Atom(Set<Kind> kinds, Set<Character> symbols) {
    static final Atom ANY = new Atom(EnumSet.allOf(Kind.class), Set.of());

    static Atom of(Kind first, Kind... rest) {
      return new Atom(EnumSet.of(first, rest), Set.of());
    }

    static Atom literal(char c) {
      if (Character.isDigit(c)) {
        return of(Kind.DIGIT);
      }
      if (Character.isLetter(c)) {
        return of(Kind.LETTER);
      }
      return Character.isWhitespace(c) ? of(Kind.SPACE) : new Atom(EnumSet.noneOf(Kind.class), Set.of(c));
    }

    boolean overlaps(Atom other) {
      if (kinds.stream().anyMatch(other.kinds()::contains) || symbols.stream().anyMatch(other.symbols()::contains)) {
        return true;
      }
      return (kinds.contains(Kind.SYMBOL) && !other.symbols().isEmpty())
          || (other.kinds().contains(Kind.SYMBOL) && !symbols.isEmpty());
    }
  }

  private record Quantifier(int min, int max, String violation) {
    static final Quantifier ONCE = new Quantifier(1, 1, null);

    boolean variable() {
      return min != max;
    }
  }
}
