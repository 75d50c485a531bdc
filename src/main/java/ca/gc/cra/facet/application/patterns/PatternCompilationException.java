package ca.gc.cra.facet.application.patterns;

/**
 * Raised when a pattern cannot enter the library: the regex is malformed, falls outside the linear-time
 * subset, lacks a declared capture group, or does not fit its tier.
 *
 * @since FACET 0.1.0
 */
public final class PatternCompilationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String patternName;

  /**
   * Creates an exception for {@code patternName}.
   *
   * @param patternName offending pattern
   * @param reason human-readable reason
   */
  public PatternCompilationException(String patternName, String reason) {
    super("Pattern '" + patternName + "' rejected: " + reason);
    this.patternName = patternName;
  }

  /**
   * Creates an exception for {@code patternName} with an underlying cause.
   *
   * @param patternName offending pattern
   * @param reason human-readable reason
   * @param cause underlying failure
   */
  public PatternCompilationException(String patternName, String reason, Throwable cause) {
    super("Pattern '" + patternName + "' rejected: " + reason, cause);
    this.patternName = patternName;
  }

  /**
   * Returns the name of the rejected pattern.
   *
   * @return pattern name
   */
  public String patternName() {
    return patternName;
  }
}
