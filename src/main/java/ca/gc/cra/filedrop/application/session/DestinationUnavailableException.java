package ca.gc.cra.filedrop.application.session;

import java.io.IOException;

/**
 * Raised when the destination file cannot be created or truncated. No payload bytes have been consumed.
 *
 * @since 0.1.0
 */
public final class DestinationUnavailableException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with the reason reported to the client and the underlying cause.
   *
   * @param reason short reason suitable for the client response
   * @param cause filesystem failure
   */
  public DestinationUnavailableException(String reason, Throwable cause) {
    super(reason, cause);
  }
}
