package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.Objects;
import java.util.Set;

/**
 * Uncompiled pattern definition as declared by {@link BuiltInPatterns} or a YAML pattern file.
 *
 * @param name unique pattern name
 * @param category category the pattern extracts
 * @param tier priority tier
 * @param regex pattern text
 * @param guard optional "must not be preceded by" pattern text; {@code null} when absent
 * @param roles capture roles the regex must declare
 * @since FACET 0.1.0
 */
public record PatternSource(
    String name,
    EntityCategory category,
    Tier tier,
    String regex,
    String guard,
    Set<CaptureRole> roles) {

  public PatternSource {
    name = Objects.requireNonNull(name, "name");
    category = Objects.requireNonNull(category, "category");
    tier = Objects.requireNonNull(tier, "tier");
    regex = Objects.requireNonNull(regex, "regex");
    guard = guard == null || guard.isBlank() ? null : guard;
    roles = roles == null ? Set.of() : Set.copyOf(roles);
  }

  /**
   * Creates a source whose roles are inferred from its named groups.
   *
   * @param name unique pattern name
   * @param category category the pattern extracts
   * @param tier priority tier
   * @param regex pattern text
   * @return unguarded source
   */
  public static PatternSource of(String name, EntityCategory category, Tier tier, String regex) {
    return new PatternSource(name, category, tier, regex, null, CaptureRole.inferFrom(regex));
  }

  /**
   * Returns a copy carrying {@code guardRegex}.
   *
   * @param guardRegex "must not be preceded by" pattern text
   * @return guarded source
   */
  public PatternSource withGuard(String guardRegex) {
    return new PatternSource(name, category, tier, regex, guardRegex, roles);
  }
}
