package ca.gc.cra.facet.infrastructure.metrics;

import ca.gc.cra.facet.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records FACET counters and observations as OpenTelemetry
 * instruments.
 * <p><strong>Role:</strong> Infrastructure adapter selected by the CLI when metrics are enabled.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created once per key in concurrent maps and are themselves
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Each instrument carries a {@code facet.metric.key} attribute holding the
 * original key; keys ending in {@code Nanos} are recorded with unit {@code ns}.</p>
 *
 * @since FACET 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("facet.metric.key");
  static final String FALLBACK_METRIC_NAME = "facet.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
    if (handle.isNoop()) {
      log.info("OpenTelemetry metrics adapter running without export");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::createCounter).add(1, attributesFor(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::createHistogram).record(value, attributesFor(key));
  }

  /** Pushes pending observations to the exporter. */
  public void flush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.forceFlush();
    handle.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("FACET counter " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("FACET observation " + key)
        .build();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> Attributes.of(METRIC_KEY_ATTRIBUTE, k));
  }

  /**
   * Maps a FACET key onto an OpenTelemetry instrument name.
   *
   * @param key dotted metric key
   * @return lower-case name of letters, digits, {@code .}, {@code _}, and {@code -}, starting with a letter
   */
  static String instrumentName(String key) {
    String trimmed = key == null ? "" : key.strip().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 6);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append("facet.");
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-' ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }
}
