package ca.gc.cra.filedrop.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by the FILEDROP commands.
 * <p><strong>Why:</strong> Gives scripts a stable way to tell a rejected upload apart from a broken invocation
 * or an unreachable server.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the command (bind failure, server unreachable). */
  IO_ERROR(3),
  /** Configuration was missing or malformed, or the storage roots are unusable. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The server refused the upload: authentication failure, access denied, or server-side error. */
  TRANSFER_REJECTED(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
