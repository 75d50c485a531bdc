package ca.gc.cra.facet.application.patterns;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles pattern sources into validated definitions.
 *
 * @since FACET 0.1.0
 */
public final class PatternCompiler {
  private static final Pattern JAVA_GROUP = Pattern.compile("\\(\\?<([A-Za-z][A-Za-z0-9_]*)>");

  private final LinearTimeRegexValidator validator = new LinearTimeRegexValidator();

  /**
   * Compiles and validates one source.
   *
   * @param source uncompiled pattern
   * @return immutable definition
   * @throws PatternCompilationException when the regex or guard is malformed or non-linear, a declared role has
   *     no group, or the roles do not fit the tier
   */
  public PatternDefinition compile(PatternSource source) throws PatternCompilationException {
    Objects.requireNonNull(source, "source");
    String name = source.name();
    if (name.isBlank()) {
      throw new PatternCompilationException("<blank>", "name must not be blank");
    }

    Pattern matcher = compileRegex(name, source.regex(), "regex");
    Pattern guard = source.guard() == null ? null : compileRegex(name, source.guard(), "guard");

    List<String> groups = groupNames(source.regex());
    Map<CaptureRole, String> roles = new EnumMap<>(CaptureRole.class);
    for (CaptureRole role : source.roles()) {
      if (!groups.contains(role.groupName())) {
        throw new PatternCompilationException(name,
            "capture role " + role + " requires group (?<" + role.groupName() + ">...)");
      }
      roles.put(role, role.groupName());
    }
    checkTierFit(name, source.tier(), roles);

    return new PatternDefinition(name, source.category(), source.tier(), matcher, roles, guard);
  }

  private Pattern compileRegex(String name, String expression, String label) throws PatternCompilationException {
    Optional<String> violation = validator.check(expression);
    if (violation.isPresent()) {
      throw new PatternCompilationException(name, label + " is not linear-time: " + violation.get());
    }
    try {
      return Pattern.compile(expression);
    } catch (PatternSyntaxException ex) {
      throw new PatternCompilationException(name, label + " does not compile: " + ex.getDescription(), ex);
    }
  }

  private void checkTierFit(String name, Tier tier, Map<CaptureRole, String> roles)
      throws PatternCompilationException {
    if (tier.isRange()) {
      if (!roles.containsKey(CaptureRole.LOW) || !roles.containsKey(CaptureRole.HIGH)) {
        throw new PatternCompilationException(name, "range tier " + tier + " requires groups lo and hi");
      }
    } else if (!roles.containsKey(CaptureRole.VALUE)) {
      throw new PatternCompilationException(name, "scalar tier " + tier + " requires group value");
    }
  }

  static List<String> groupNames(String regex) {
    List<String> names = new ArrayList<>();
    Matcher javaStyle = JAVA_GROUP.matcher(regex);
    while (javaStyle.find()) {
      names.add(javaStyle.group(1));
    }
    return List.copyOf(names);
  }
}
