package ca.gc.cra.filedrop.application.session;

import java.io.IOException;

/**
 * Raised when a peer sends a malformed, oversized, or truncated protocol field.
 *
 * @since 0.1.0
 */
public class ProtocolException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ProtocolException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause underlying I/O failure
   */
  public ProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
