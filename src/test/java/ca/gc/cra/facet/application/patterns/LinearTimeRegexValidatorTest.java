package ca.gc.cra.facet.application.patterns;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LinearTimeRegexValidatorTest {
  private final LinearTimeRegexValidator validator = new LinearTimeRegexValidator();

  @ParameterizedTest
  @ValueSource(strings = {
      "\\$\\d{1,9}(?:,\\d{3}){0,6}",
      "(?<lo>\\d{1,9})\\s{0,3}-\\s{0,3}(?<hi>\\d{1,9})",
      "(?:ab){1,5}c",
      "(?:a{1,5}b)?",
      "[(+*]{1,9}",
      "\\Q(a+)+\\E",
      "\\d{1,100}",
      "\\d{1,9}\\s{0,3}\\d{1,9}",
      "May\\.?,?\\s{1,3}\\d{4}",
      "(?<value>\\d{100}\\d{100})%"})
  void acceptsBoundedPatterns(String regex) {
    Optional<String> violation = validator.check(regex);
    assertTrue(violation.isEmpty(), () -> regex + " rejected: " + violation.orElse(""));
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "(a+)+",
      "(?:\\d*\\s)*x",
      "\\d+",
      "x\\s*",
      "a{2,}",
      "(a{1,5}){2,3}",
      "(?:a|(?:b{1,3})){1,4}",
      "(\\w)\\1",
      "(?<x>a)\\k<x>",
      "foo(?=bar)",
      "foo(?!bar)",
      "(?<=\\$)\\d",
      "(?<!-)\\d",
      "(?>a|ab)c",
      "\\d{1,9}+",
      "a{2,5000}",
      "a{1,101}"})
  void rejectsBacktrackingConstructs(String regex) {
    assertTrue(validator.check(regex).isPresent(), () -> regex + " should be rejected");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "(?<value>\\d*\\d*\\d*\\d*)%",
      "(?<value>\\d{0,9}\\d{0,9}\\d{0,9})%",
      "\\w{1,9}\\d{1,9}",
      "[0-9]{1,3}\\d?",
      ".{0,3},?"})
  void rejectsStackedRepetitionsOverSharedCharacters(String regex) {
    Optional<String> violation = validator.check(regex);
    assertTrue(violation.isPresent(), () -> regex + " should be rejected");
    assertTrue(violation.get().contains("unbounded") || violation.get().contains("adjacent"), violation::get);
  }

  @Test
  void everyBuiltInPatternIsLinear() {
    for (PatternSource source : BuiltInPatterns.sources()) {
      Optional<String> violation = validator.check(source.regex());
      assertTrue(violation.isEmpty(), () -> source.name() + ": " + violation.orElse(""));
      if (source.guard() != null) {
        Optional<String> guardViolation = validator.check(source.guard());
        assertTrue(guardViolation.isEmpty(), () -> source.name() + " guard: " + guardViolation.orElse(""));
      }
    }
  }
}
