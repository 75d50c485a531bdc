package ca.gc.cra.facet.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Stdout for usage text and NDJSON entity lines.
 *
 * <p>Writes to the native stdout descriptor so logging, which goes to stderr, never interleaves with
 * command output.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Returns the active stdout writer; callers flush but never close it.
   *
   * @return shared writer, or the test override
   */
  public static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /** Clears any test writer override. */
  static void clearTestWriter() {
    override = null;
  }
}
