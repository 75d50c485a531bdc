package ca.gc.cra.facet.application.patterns;

import ca.gc.cra.facet.domain.entity.EntityCategory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable, tier-ordered table of compiled pattern definitions.
 * <p><strong>Why:</strong> One source of truth for priority ordering, built once and passed by reference into
 * every extraction call.</p>
 * <p><strong>Role:</strong> Read-only input to {@code EntityExtractor}; assembled by {@link Builder} or
 * {@link PatternLibraryProvider}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compile every source and exclude failures, recording them as {@link Rejection}s.</li>
 *   <li>Order definitions by tier, keeping declaration order inside a tier.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Compilation happens once; lookups are list traversals.</p>
 * <p><strong>Observability:</strong> Logs one WARN per rejected pattern at build time.</p>
 *
 * @since FACET 0.1.0
 */
public final class PatternLibrary {
  private static final Logger log = LoggerFactory.getLogger(PatternLibrary.class);

  private final List<PatternDefinition> patterns;
  private final List<Rejection> rejections;

  private PatternLibrary(List<PatternDefinition> patterns, List<Rejection> rejections) {
    this.patterns = List.copyOf(patterns);
    this.rejections = List.copyOf(rejections);
  }

  /**
   * Creates an empty builder.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds the library from the built-in tier table.
   *
   * @return library holding every built-in pattern that compiles
   */
  public static PatternLibrary builtIn() {
    return builder().addAll(BuiltInPatterns.sources()).build();
  }

  /**
   * Returns all definitions in evaluation order.
   *
   * @return immutable list sorted by tier, declaration order within a tier
   */
  public List<PatternDefinition> patterns() {
    return patterns;
  }

  /**
   * Returns the definitions of one tier in declaration order.
   *
   * @param tier tier to select
   * @return immutable list, possibly empty
   */
  public List<PatternDefinition> patternsIn(Tier tier) {
    Objects.requireNonNull(tier, "tier");
    List<PatternDefinition> selected = new ArrayList<>();
    for (PatternDefinition pattern : patterns) {
      if (pattern.tier() == tier) {
        selected.add(pattern);
      }
    }
    return List.copyOf(selected);
  }

  /**
   * Returns the sources excluded at build time.
   *
   * @return immutable list of rejections
   */
  public List<Rejection> rejections() {
    return rejections;
  }

  /**
   * Returns the number of usable definitions.
   *
   * @return pattern count
   */
  public int size() {
    return patterns.size();
  }

  /**
   * Returns a library limited to {@code categories}. Rejections are carried over.
   *
   * @param categories categories to keep; an empty set keeps nothing
   * @return restricted library
   */
  public PatternLibrary restrictTo(Set<EntityCategory> categories) {
    Objects.requireNonNull(categories, "categories");
    Set<EntityCategory> keep = categories.isEmpty()
        ? EnumSet.noneOf(EntityCategory.class)
        : EnumSet.copyOf(categories);
    List<PatternDefinition> selected = new ArrayList<>();
    for (PatternDefinition pattern : patterns) {
      if (keep.contains(pattern.category())) {
        selected.add(pattern);
      }
    }
    return new PatternLibrary(selected, rejections);
  }

  /**
   * A source that could not enter the library.
   *
   * @param patternName rejected pattern name
   * @param reason human-readable reason
   */
  public record Rejection(String patternName, String reason) {
    public Rejection {
      patternName = Objects.requireNonNull(patternName, "patternName");
      reason = Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * Collects sources and compiles them into a library.
   *
   * <p>Not thread-safe; intended for single-threaded start-up.</p>
   */
  public static final class Builder {
    private final List<PatternSource> sources = new ArrayList<>();
    private final PatternCompiler compiler = new PatternCompiler();

    private Builder() {}

    /**
     * Appends one source after those already added.
     *
     * @param source pattern source
     * @return this builder
     */
    public Builder add(PatternSource source) {
      sources.add(Objects.requireNonNull(source, "source"));
      return this;
    }

    /**
     * Appends sources in iteration order.
     *
     * @param additional pattern sources
     * @return this builder
     */
    public Builder addAll(Collection<PatternSource> additional) {
      for (PatternSource source : additional) {
        add(source);
      }
      return this;
    }

    /**
     * Compiles every source, excluding and reporting failures.
     *
     * @return immutable library
     */
    public PatternLibrary build() {
      List<PatternDefinition> compiled = new ArrayList<>(sources.size());
      List<Rejection> rejected = new ArrayList<>();
      Set<String> names = new HashSet<>();
      for (PatternSource source : sources) {
        try {
          compiled.add(compileUnique(source, names));
        } catch (PatternCompilationException ex) {
          log.warn("Excluding pattern {}: {}", ex.patternName(), ex.getMessage());
          rejected.add(new Rejection(ex.patternName(), ex.getMessage()));
        }
      }
      return assemble(compiled, rejected);
    }

    /**
     * Compiles every source, failing on the first one that cannot be compiled.
     *
     * @return immutable library without rejections
     * @throws PatternCompilationException for the first failing source
     */
    public PatternLibrary buildStrict() throws PatternCompilationException {
      List<PatternDefinition> compiled = new ArrayList<>(sources.size());
      Set<String> names = new HashSet<>();
      for (PatternSource source : sources) {
        compiled.add(compileUnique(source, names));
      }
      return assemble(compiled, List.of());
    }

    private PatternDefinition compileUnique(PatternSource source, Set<String> names)
        throws PatternCompilationException {
      PatternDefinition definition = compiler.compile(source);
      if (!names.add(definition.name())) {
        throw new PatternCompilationException(definition.name(), "duplicate pattern name");
      }
      return definition;
    }

    private static PatternLibrary assemble(List<PatternDefinition> compiled, List<Rejection> rejected) {
      compiled.sort(Comparator.comparingInt(pattern -> pattern.tier().rank()));
      log.debug("Pattern library built with {} pattern(s), {} rejected", compiled.size(), rejected.size());
      return new PatternLibrary(compiled, rejected);
    }
  }
}
