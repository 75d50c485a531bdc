package ca.gc.cra.facet.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from system properties first, then environment variables:
 * {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} ({@code otlp} or {@code none}),
 * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT}, and
 * {@code otel.metric.export.interval}/{@code OTEL_METRIC_EXPORT_INTERVAL} in milliseconds.</p>
 *
 * @since FACET 0.1.0
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.facet";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/FACET/pom.properties";

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Initializes a meter from system properties and the environment.
   *
   * @return handle; noop when the exporter is disabled or initialization fails
   */
  static MeterHandle initialize() {
    return initialize(name -> System.getProperty(name), System::getenv);
  }

  static MeterHandle initialize(Function<String, String> properties, Function<String, String> environment) {
    try {
      Settings settings = Settings.resolve(properties, environment);
      if (!settings.exporterEnabled()) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return MeterHandle.noop();
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder()
          .setEndpoint(settings.endpoint())
          .build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(settings.interval()).build();
      log.info("OpenTelemetry metrics exporting to {} every {}s", settings.endpoint(),
          settings.interval().toSeconds());
      return withReader(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return MeterHandle.noop();
    }
  }

  /**
   * Builds a meter backed by {@code reader}, used by tests with an in-memory reader.
   *
   * @param reader metric reader
   * @return active handle
   */
  static MeterHandle withReader(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(
            AttributeKey.stringKey("service.name"), "facet",
            AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
            AttributeKey.stringKey("service.version"), version))))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, provider);
  }

  static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read {} for version detection", POM_PROPERTIES, ex);
    }
    return "0.0.0-dev";
  }

  record Settings(boolean exporterEnabled, String endpoint, Duration interval) {

    static Settings resolve(Function<String, String> properties, Function<String, String> environment) {
      String exporter = firstNonBlank(properties.apply("otel.metrics.exporter"),
          environment.apply("OTEL_METRICS_EXPORTER"), "otlp").toLowerCase(Locale.ROOT);
      boolean enabled = switch (exporter) {
        case "none" -> false;
        case "otlp" -> true;
        default -> {
          log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
          yield true;
        }
      };
      String endpoint = firstNonBlank(properties.apply("otel.exporter.otlp.endpoint"),
          environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      String intervalMillis = firstNonBlank(properties.apply("otel.metric.export.interval"),
          environment.apply("OTEL_METRIC_EXPORT_INTERVAL"), "");
      Duration interval = DEFAULT_INTERVAL;
      if (!intervalMillis.isEmpty()) {
        try {
          long millis = Long.parseLong(intervalMillis);
          if (millis > 0) {
            interval = Duration.ofMillis(millis);
          } else {
            log.warn("Ignoring non-positive metric export interval {}", intervalMillis);
          }
        } catch (NumberFormatException ex) {
          log.warn("Ignoring malformed metric export interval '{}'", intervalMillis);
        }
      }
      return new Settings(enabled, endpoint, interval);
    }

    private static String firstNonBlank(String first, String second, String fallback) {
      if (first != null && !first.isBlank()) {
        return first.trim();
      }
      if (second != null && !second.isBlank()) {
        return second.trim();
      }
      return fallback;
    }
  }

  /** Meter plus the provider that must be flushed and shut down with it. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
