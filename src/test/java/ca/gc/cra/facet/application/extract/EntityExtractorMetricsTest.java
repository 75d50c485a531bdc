package ca.gc.cra.facet.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.facet.application.patterns.PatternCompilationException;
import ca.gc.cra.facet.application.patterns.PatternLibrary;
import ca.gc.cra.facet.application.patterns.PatternSource;
import ca.gc.cra.facet.application.patterns.Tier;
import ca.gc.cra.facet.application.port.MetricsPort;
import ca.gc.cra.facet.domain.entity.EntityCategory;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class EntityExtractorMetricsTest {

  @Test
  void committedSpansAreCountedPerTier() {
    RecordingMetrics metrics = new RecordingMetrics();
    EntityExtractor extractor = new EntityExtractor(PatternLibrary.builtIn(), metrics);

    extractor.extract("$1-5 million and later $20");

    assertEquals(1L, metrics.counter(EntityExtractor.CALLS));
    assertEquals(1L, metrics.counter("extract.tier.2.committed"));
    assertEquals(1L, metrics.counter("extract.tier.3.committed"));
    assertEquals(0L, metrics.counter(EntityExtractor.DROPPED));
    assertEquals(2L, metrics.observation(EntityExtractor.ENTITIES));
    assertTrue(metrics.observations.containsKey(EntityExtractor.LATENCY));
  }

  @Test
  void unreadableCandidateIsCountedAndLoggedAtDebug() {
    RecordingMetrics metrics = new RecordingMetrics();
    EntityExtractor extractor = new EntityExtractor(PatternLibrary.builtIn(), metrics);
    Logger logger = (Logger) LoggerFactory.getLogger(EntityExtractor.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);

    try {
      assertTrue(extractor.extract("Due February 30, 2024").isEmpty());
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertEquals(1L, metrics.counter("extract.tier.3.committed"));
    assertEquals(1L, metrics.counter(EntityExtractor.DROPPED));
    assertEquals(0L, metrics.observation(EntityExtractor.ENTITIES));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.DEBUG
        && event.getFormattedMessage().contains("date.full")));
  }

  @Test
  void overflowingLiteralIsDroppedQuietly() throws PatternCompilationException {
    RecordingMetrics metrics = new RecordingMetrics();
    PatternLibrary library = PatternLibrary.builder()
        .add(PatternSource.of("measurement.wide", EntityCategory.MEASUREMENT, Tier.BARE_SCALAR,
            "(?<value>\\d{100}\\d{100}\\d{100}\\d{100})%"))
        .buildStrict();
    EntityExtractor extractor = new EntityExtractor(library, metrics);
    Logger logger = (Logger) LoggerFactory.getLogger(EntityExtractor.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    try {
      assertTrue(extractor.extract("1".repeat(400) + "%").isEmpty());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(1L, metrics.counter(EntityExtractor.DROPPED));
    assertTrue(appender.list.stream().noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.WARN)),
        () -> "unexpected warnings " + appender.list);
  }

  @Test
  void emptyInputStillCountsCall() {
    RecordingMetrics metrics = new RecordingMetrics();
    EntityExtractor extractor = new EntityExtractor(PatternLibrary.builtIn(), metrics);

    extractor.extract("");
    extractor.extract(null);

    assertEquals(2L, metrics.counter(EntityExtractor.CALLS));
    assertTrue(metrics.observations.isEmpty());
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, Long> observations = new HashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {
      observations.put(key, value);
    }

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }

    long observation(String key) {
      return observations.getOrDefault(key, 0L);
    }
  }
}
