package ca.gc.cra.facet.application.extract;

import ca.gc.cra.facet.application.patterns.PatternDefinition;
import ca.gc.cra.facet.application.patterns.PatternLibrary;
import ca.gc.cra.facet.application.port.MetricsPort;
import ca.gc.cra.facet.domain.entity.Entity;
import ca.gc.cra.facet.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Finds dates, times, money amounts, and measurements in plain text.
 * <p><strong>Why:</strong> Downstream writers need one position-ordered, conflict-free list of typed facts per
 * document.</p>
 * <p><strong>Role:</strong> Application use case; drives {@link SpanAllocator}, {@link EntityParser}, and
 * {@link ResultAssembler} over an injected {@link PatternLibrary}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run every pattern tier by tier, committing the first non-overlapping claim on each region.</li>
 *   <li>Drop candidates whose values cannot be read while keeping their region claimed.</li>
 *   <li>Return spans as codepoint offsets sorted by start.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; all allocation state is local to {@link #extract(String)}.</p>
 * <p><strong>Performance:</strong> One scan of the text per pattern. Patterns are restricted to bounded
 * repetition when the library is built, so each scan is linear in the text length.</p>
 * <p><strong>Observability:</strong> Emits {@code extract.calls}, {@code extract.entities},
 * {@code extract.candidates.dropped}, {@code extract.latencyNanos}, and {@code extract.tier.N.committed}.</p>
 *
 * @since FACET 0.1.0
 */
public final class EntityExtractor {
  private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

  static final String CALLS = "extract.calls";
  static final String ENTITIES = "extract.entities";
  static final String DROPPED = "extract.candidates.dropped";
  static final String LATENCY = "extract.latencyNanos";

  private final PatternLibrary library;
  private final MetricsPort metrics;
  private final EntityParser parser = new EntityParser();
  private final ResultAssembler assembler = new ResultAssembler();

  /**
   * Creates an extractor over {@code library}.
   *
   * @param library immutable pattern table
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} to disable
   */
  public EntityExtractor(PatternLibrary library, MetricsPort metrics) {
    this.library = Objects.requireNonNull(library, "library");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates an extractor over the built-in patterns without metrics.
   *
   * @return extractor
   */
  public static EntityExtractor withBuiltInPatterns() {
    return new EntityExtractor(PatternLibrary.builtIn(), MetricsPort.NO_OP);
  }

  /**
   * Extracts every entity from {@code text}.
   *
   * <p>Never throws; a candidate that fails unexpectedly is logged, counted, and dropped.</p>
   *
   * @param text plain document text; {@code null} and empty text yield an empty list
   * @return unmodifiable list ordered by span start, spans in codepoint offsets
   */
  public List<Entity> extract(String text) {
    metrics.increment(CALLS);
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    long started = System.nanoTime();
    SpanAllocator allocator = new SpanAllocator();
    List<Entity> parsed = new ArrayList<>();
    for (PatternDefinition pattern : library.patterns()) {
      scan(text, pattern, allocator, parsed);
    }
    List<Entity> result = assembler.assemble(text, parsed);
    metrics.observe(ENTITIES, result.size());
    metrics.observe(LATENCY, System.nanoTime() - started);
    return result;
  }

  private void scan(String text, PatternDefinition pattern, SpanAllocator allocator, List<Entity> parsed) {
    Matcher match = pattern.matcher().matcher(text);
    while (match.find()) {
      int start = match.start();
      int end = match.end();
      if (end <= start || splitsDigitRun(text, start, end) || allocator.overlaps(start, end)
          || pattern.guardRejects(text, start)) {
        continue;
      }
      Optional<CommittedSpan> committed = allocator.tryCommit(start, end, pattern);
      if (committed.isEmpty()) {
        continue;
      }
      metrics.increment(pattern.tier().committedMetricKey());
      Optional<Entity> entity = parseCandidate(text, committed.get(), match);
      if (entity.isPresent()) {
        parsed.add(entity.get());
      } else {
        metrics.increment(DROPPED);
      }
    }
  }

  /** Bounded repetitions can stop inside a longer number; such a match is a fragment, not a value. */
  private static boolean splitsDigitRun(String text, int start, int end) {
    boolean cutAtStart = start > 0 && Character.isDigit(text.charAt(start - 1))
        && Character.isDigit(text.charAt(start));
    boolean cutAtEnd = end < text.length() && Character.isDigit(text.charAt(end - 1))
        && Character.isDigit(text.charAt(end));
    return cutAtStart || cutAtEnd;
  }

  private Optional<Entity> parseCandidate(String text, CommittedSpan committed, Matcher match) {
    try {
      Optional<Entity> entity = parser.parse(text, committed, match);
      if (entity.isEmpty() && log.isDebugEnabled()) {
        log.debug("Dropped candidate '{}' at [{}, {}) from pattern {}: value could not be read",
            Logs.snippet(match.group()), committed.start(), committed.end(), committed.pattern().name());
      }
      return entity;
    } catch (RuntimeException ex) {
      log.warn("Dropped candidate at [{}, {}) from pattern {}: {}",
          committed.start(), committed.end(), committed.pattern().name(), ex.toString(), ex);
      return Optional.empty();
    }
  }
}
