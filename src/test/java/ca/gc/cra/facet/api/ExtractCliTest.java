package ca.gc.cra.facet.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ExtractCliTest {
  private static final String DOCUMENT = "On March 15, 2024 at 9:30 AM we paid $1,200 for 15 kg.";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter stdout;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ExtractCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    stdout = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(stdout));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"--help"}));
    assertTrue(stdout.toString().startsWith("FACET extract"));
  }

  @Test
  void missingInputArgumentIsInvalid() {
    ExitCode code = ExtractCli.run(new String[] {"categories=money"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(stdout.toString().contains("usage: extract"));
    assertTrue(logged(Level.ERROR, "Missing required argument: in"));
  }

  @Test
  void malformedArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, ExtractCli.run(new String[] {"in"}));
    assertTrue(logged(Level.ERROR, "Invalid argument"));
  }

  @Test
  void missingInputFileIsInvalid() {
    ExitCode code = ExtractCli.run(new String[] {"in=" + tempDir.resolve("absent.txt")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "in does not exist"));
  }

  @Test
  void writesNdjsonToStdout() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);

    ExitCode code = ExtractCli.run(new String[] {"in=" + in});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = stdout.toString().lines().toList();
    assertEquals(4, lines.size());
    assertTrue(lines.get(0).startsWith("{\"category\":\"DATE\""), lines.get(0));
    assertTrue(lines.stream().anyMatch(line -> line.contains("\"rawText\":\"$1,200\"")));
    assertTrue(logged(Level.INFO, "Extracted 4 entities"));
  }

  @Test
  void invalidUtf8IsReplacedForFilesAndStdinAlike() throws IOException {
    byte[] bytes = {'P', 'a', 'i', 'd', ' ', '$', '5', ' ', (byte) 0xFF, ' ', 'o', 'k'};
    Path in = Files.write(tempDir.resolve("latin1.txt"), bytes);

    assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"in=" + in}));
    String fromFile = stdout.toString();

    stdout.getBuffer().setLength(0);
    InputStream originalIn = System.in;
    try {
      System.setIn(new ByteArrayInputStream(bytes));
      assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"in=-"}));
    } finally {
      System.setIn(originalIn);
    }

    assertTrue(fromFile.contains("\"rawText\":\"$5\""), fromFile);
    assertEquals(fromFile, stdout.toString());
  }

  @Test
  void writesNdjsonToOutputFileWithCategoryFilter() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);
    Path out = tempDir.resolve("entities.ndjson");

    ExitCode code = ExtractCli.run(new String[] {"in=" + in, "out=" + out, "categories=money,measurement"});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(out);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).contains("\"category\":\"MONEY\""));
    assertTrue(lines.get(1).contains("\"category\":\"MEASUREMENT\""));
    assertEquals("", stdout.toString());
  }

  @Test
  void customPatternFileAddsEntities() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), "Disk: 12 GB free");
    Path patterns = Files.writeString(tempDir.resolve("storage.yaml"), """
        version: 1
        patterns:
          - name: measurement.storage
            category: measurement
            tier: 3
            regex: '\\b(?<value>\\d{1,9}(?:\\.\\d{1,9})?)\\s{0,3}(?<unit>GB|TB)\\b'
        """);

    ExitCode code = ExtractCli.run(new String[] {"in=" + in, "patterns=" + patterns});

    assertEquals(ExitCode.SUCCESS, code);
    String output = stdout.toString();
    assertTrue(output.contains("\"pattern\":\"measurement.storage\""), output);
    assertTrue(output.contains("\"unit\":\"GB\""), output);
  }

  @Test
  void strictModeRejectsBacktrackingPattern() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);
    Path patterns = Files.writeString(tempDir.resolve("bad.yaml"), """
        version: 1
        patterns:
          - name: money.catastrophic
            category: money
            tier: complete_single
            regex: '(?<value>(\\d+,?)+)\\s*dollars'
        """);

    assertEquals(ExitCode.CONFIG_ERROR,
        ExtractCli.run(new String[] {"in=" + in, "patterns=" + patterns, "--strict"}));
    assertTrue(logged(Level.ERROR, "Strict mode"));

    stdout.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"in=" + in, "patterns=" + patterns}));
    assertEquals(4, stdout.toString().lines().count());
  }

  @Test
  void oversizedInputIsRejected() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);

    ExitCode code = ExtractCli.run(new String[] {"in=" + in, "maxInputBytes=16"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "maxInputBytes is 16"));
    assertEquals("", stdout.toString());
  }

  @Test
  void invalidConfigurationValueIsConfigError() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);

    assertEquals(ExitCode.CONFIG_ERROR, ExtractCli.run(new String[] {"in=" + in, "categories=weather"}));
    assertEquals(ExitCode.CONFIG_ERROR,
        ExtractCli.run(new String[] {"in=" + in, "config=" + tempDir.resolve("absent.yaml")}));
    assertFalse(Files.exists(tempDir.resolve("entities.ndjson")));
  }

  @Test
  void configFileSelectsCategories() throws IOException {
    Path in = Files.writeString(tempDir.resolve("doc.txt"), DOCUMENT);
    Path yaml = Files.writeString(tempDir.resolve("facet.yaml"), """
        extract:
          categories: [time]
        """);

    assertEquals(ExitCode.SUCCESS, ExtractCli.run(new String[] {"in=" + in, "config=" + yaml}));
    List<String> lines = stdout.toString().lines().toList();
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).contains("\"category\":\"TIME\""));
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
