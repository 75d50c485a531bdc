package ca.gc.cra.facet.api;

import ca.gc.cra.facet.application.extract.EntityExtractor;
import ca.gc.cra.facet.application.patterns.PatternCompilationException;
import ca.gc.cra.facet.application.patterns.PatternLibrary;
import ca.gc.cra.facet.application.patterns.PatternLibraryProvider;
import ca.gc.cra.facet.application.port.MetricsPort;
import ca.gc.cra.facet.config.ExtractConfig;
import ca.gc.cra.facet.domain.entity.Entity;
import ca.gc.cra.facet.infrastructure.json.EntityJsonWriter;
import ca.gc.cra.facet.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.facet.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.facet.logging.LoggingConfigurator;
import ca.gc.cra.facet.validation.Paths;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for extracting entities from one document and writing them as NDJSON.
 *
 * @since FACET 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String STDIN = "-";
  private static final String SUMMARY_USAGE =
      "usage: extract in=PATH|- [out=PATH] [config=PATH] [patterns=FILES] [categories=LIST] "
          + "[maxInputBytes=N] [--strict] [--metrics] [--verbose]";
  private static final String HELP_TEXT = """
      FACET extract

      Usage:
        extract in=./report.txt [out=./entities.ndjson] [options]

      Required:
        in=PATH|-              Plain-text UTF-8 document; '-' reads stdin

      Optional:
        out=PATH               NDJSON destination (default stdout)
        config=PATH            YAML configuration with common/extract sections
        patterns=FILES         Comma-separated custom pattern files
        categories=LIST        Comma-separated subset of date,time,money,measurement
        maxInputBytes=N        Reject documents larger than N bytes (default 16777216)
        --strict               Fail when any pattern is rejected
        --metrics              Export metrics through OpenTelemetry (OTEL_* environment)
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private ExtractCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  @SuppressFBWarnings(value = "DM_EXIT", justification = "CLI entry point reports its exit code to the shell.")
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs one extraction and reports the outcome as an exit code.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String in = kv.remove("in");
    String out = kv.remove("out");
    if (in == null) {
      log.error("Missing required argument: in");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ExtractConfig config;
    try {
      config = ConfigCliUtils.resolve(input, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Path inputPath = null;
    Path outputPath = null;
    try {
      if (!STDIN.equals(in)) {
        inputPath = Paths.requireReadableFile("in", Path.of(in));
      }
      if (out != null) {
        outputPath = Paths.validateOutputFile("out", Path.of(out));
      }
      for (Path file : config.patternFiles()) {
        Paths.requireReadableFile("patterns", file);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract paths: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PatternLibrary library;
    try {
      library = new PatternLibraryProvider().load(config.patternFiles(), config.categories(), config.strict());
    } catch (PatternCompilationException ex) {
      log.error("Strict mode: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pattern file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read pattern files {}", config.patternFiles(), ex);
      return ExitCode.IO_ERROR;
    }

    String source = inputPath == null ? "<stdin>" : inputPath.toString();
    OpenTelemetryMetricsAdapter otel = config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : null;
    MetricsPort metrics = otel != null ? otel : new NoOpMetricsAdapter();
    try {
      String text = readDocument(inputPath, config.maxInputBytes());
      EntityExtractor extractor = new EntityExtractor(library, metrics);
      long started = System.nanoTime();
      List<Entity> entities = extractor.extract(text);
      long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;
      int written = write(entities, outputPath);
      log.info("Extracted {} entities from {} ({} patterns, categories={}) in {} ms",
          written, source, library.size(), config.categoriesText(), elapsedMillis);
      return ExitCode.SUCCESS;
    } catch (InputTooLargeException ex) {
      log.error(ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Extract I/O failure for {}", source, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while extracting {}", source, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (otel != null) {
        otel.close();
      }
    }
  }

  private static String readDocument(Path inputPath, long maxInputBytes) throws IOException {
    byte[] bytes;
    if (inputPath != null) {
      long size = Files.size(inputPath);
      if (size > maxInputBytes) {
        throw new InputTooLargeException(inputPath.toString(), size, maxInputBytes);
      }
      bytes = Files.readAllBytes(inputPath);
    } else {
      InputStream stdin = System.in;
      bytes = stdin.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, maxInputBytes + 1));
      if (bytes.length > maxInputBytes) {
        throw new InputTooLargeException("<stdin>", bytes.length, maxInputBytes);
      }
    }
    return decode(bytes);
  }

  /** Decodes UTF-8 the same way for files and stdin; malformed bytes become U+FFFD. */
  private static String decode(byte[] bytes) throws CharacterCodingException {
    return StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  private static int write(List<Entity> entities, Path outputPath) throws IOException {
    EntityJsonWriter json = new EntityJsonWriter();
    if (outputPath == null) {
      return json.writeLines(CliPrinter.writer(), entities);
    }
    try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
      return json.writeLines(writer, entities);
    }
  }

  /** Raised when a document exceeds {@code maxInputBytes}. */
  private static final class InputTooLargeException extends IOException {
    private static final long serialVersionUID = 1L;

    InputTooLargeException(String source, long size, long limit) {
      super("Input " + source + " is " + size + " bytes; maxInputBytes is " + limit);
    }
  }
}
