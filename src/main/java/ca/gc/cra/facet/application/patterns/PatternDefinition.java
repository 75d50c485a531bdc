package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Compiled, validated pattern with its category, tier, and capture roles.
 * <p><strong>Why:</strong> Built once so every extraction call reads the same immutable table.</p>
 * <p><strong>Role:</strong> Element of {@link PatternLibrary}; consumed by the span allocator and entity parser.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@link Pattern} instances are safe to share, matchers are per call.</p>
 *
 * @param name unique pattern name
 * @param category category the pattern extracts
 * @param tier priority tier
 * @param matcher compiled pattern
 * @param captureRoles role to group-name bindings
 * @param guard optional compiled "must not be preceded by" pattern; {@code null} when absent
 * @since FACET 0.1.0
 */
public record PatternDefinition(
    String name,
    EntityCategory category,
    Tier tier,
    Pattern matcher,
    Map<CaptureRole, String> captureRoles,
    Pattern guard) {

  /** Number of characters before a candidate that a guard may inspect. */
  public static final int GUARD_WINDOW = 24;

  public PatternDefinition {
    name = Objects.requireNonNull(name, "name");
    category = Objects.requireNonNull(category, "category");
    tier = Objects.requireNonNull(tier, "tier");
    matcher = Objects.requireNonNull(matcher, "matcher");
    captureRoles = captureRoles == null ? Map.of() : Map.copyOf(captureRoles);
  }

  /**
   * Indicates whether the pattern binds {@code role}.
   *
   * @param role capture role
   * @return {@code true} when a group carries the role
   */
  public boolean hasRole(CaptureRole role) {
    return captureRoles.containsKey(role);
  }

  /**
   * Returns the text captured for {@code role} by a live matcher of this pattern.
   *
   * @param match matcher positioned on a match of {@link #matcher()}
   * @param role capture role
   * @return captured text, or {@code null} when the role is unbound or its group did not participate
   */
  public String capture(Matcher match, CaptureRole role) {
    String group = captureRoles.get(role);
    return group == null ? null : match.group(group);
  }

  /**
   * Checks the guard against the text just before a candidate.
   *
   * <p>The guard runs over a window of up to {@value #GUARD_WINDOW} characters ending at {@code start} and
   * rejects when it matches at the window end. Word boundaries see the text outside the window.</p>
   *
   * @param text full input text
   * @param start candidate start offset
   * @return {@code true} when the candidate must be skipped
   */
  public boolean guardRejects(CharSequence text, int start) {
    if (guard == null || start == 0) {
      return false;
    }
    Matcher preceding = guard.matcher(text);
    preceding.region(Math.max(0, start - GUARD_WINDOW), start);
    preceding.useTransparentBounds(true);
    preceding.useAnchoringBounds(true);
    return preceding.find();
  }
}
