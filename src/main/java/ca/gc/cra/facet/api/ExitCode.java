package ca.gc.cra.facet.api;

/**
 * <strong>What:</strong> Process exit codes shared by FACET commands.
 * <p><strong>Why:</strong> Scripts tell bad arguments apart from unreadable files and rejected patterns.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since FACET 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Input or output could not be read or written. */
  IO_ERROR(3),
  /** Configuration or a pattern file was malformed, or a pattern was rejected in strict mode. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the shell.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
