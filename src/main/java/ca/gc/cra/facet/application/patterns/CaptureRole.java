package ca.gc.cra.facet.application.patterns;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Meaning of a named capture group inside a pattern.
 *
 * @since FACET 0.1.0
 */
public enum CaptureRole {
  LOW("lo"),
  HIGH("hi"),
  VALUE("value"),
  UNIT("unit"),
  LOW_UNIT("loUnit"),
  HIGH_UNIT("hiUnit"),
  YEAR("year");

  private final String groupName;

  CaptureRole(String groupName) {
    this.groupName = groupName;
  }

  /**
   * Returns the regex group name bound to this role.
   *
   * @return group name such as {@code lo}
   */
  public String groupName() {
    return groupName;
  }

  /**
   * Looks up the role bound to a group name.
   *
   * @param name regex group name
   * @return role, or empty for groups with no extraction meaning
   */
  public static Optional<CaptureRole> fromGroupName(String name) {
    for (CaptureRole role : values()) {
      if (role.groupName.equals(name)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /**
   * Infers roles from the named groups declared in {@code regex}.
   *
   * @param regex pattern text
   * @return roles whose group names appear in the pattern
   */
  public static Set<CaptureRole> inferFrom(String regex) {
    Set<CaptureRole> roles = EnumSet.noneOf(CaptureRole.class);
    for (String name : PatternCompiler.groupNames(regex)) {
      fromGroupName(name).ifPresent(roles::add);
    }
    return roles;
  }
}
