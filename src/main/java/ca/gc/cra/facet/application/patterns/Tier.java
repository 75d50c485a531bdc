package ca.gc.cra.facet.application.patterns;

/**
 * Priority tiers, widest context first. A lower rank always wins a contested region.
 *
 * @since FACET 0.1.0
 */
public enum Tier {
  /** Range preceded by a cue word such as {@code range}, {@code from}, or {@code between}. */
  CONTEXT_RANGE(1),
  /** Two bounds joined by an operator without a cue word. */
  BARE_RANGE(2),
  /** Fully formed date, time, or money literal. */
  COMPLETE_SINGLE(3),
  /** Single value preceded by a negation cue. */
  NEGATIVE_SCALAR(4),
  /** Number plus unit without other context. */
  BARE_SCALAR(5);

  private final int rank;
  private final String committedMetricKey;

  Tier(int rank) {
    this.rank = rank;
    this.committedMetricKey = "extract.tier." + rank + ".committed";
  }

  /**
   * Returns the numeric priority; 1 is evaluated first.
   *
   * @return rank between 1 and 5
   */
  public int rank() {
    return rank;
  }

  /**
   * Indicates whether patterns in this tier produce ranges.
   *
   * @return {@code true} for tiers 1 and 2
   */
  public boolean isRange() {
    return this == CONTEXT_RANGE || this == BARE_RANGE;
  }

  /**
   * Indicates whether patterns in this tier force a negative sign.
   *
   * @return {@code true} for tier 4
   */
  public boolean isNegative() {
    return this == NEGATIVE_SCALAR;
  }

  /**
   * Returns the counter incremented for every span this tier commits.
   *
   * @return metric key such as {@code extract.tier.2.committed}
   */
  public String committedMetricKey() {
    return committedMetricKey;
  }

  /**
   * Resolves a tier from its rank.
   *
   * @param rank rank between 1 and 5
   * @return matching tier
   * @throws IllegalArgumentException when no tier has {@code rank}
   */
  public static Tier fromRank(int rank) {
    for (Tier tier : values()) {
      if (tier.rank == rank) {
        return tier;
      }
    }
    throw new IllegalArgumentException("tier must be between 1 and 5 (was " + rank + ")");
  }
}
