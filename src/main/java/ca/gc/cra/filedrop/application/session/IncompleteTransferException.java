package ca.gc.cra.filedrop.application.session;

import java.io.IOException;

/**
 * Raised when the payload ends or fails before the declared length was received.
 *
 * <p>The destination keeps whatever bytes arrived; no attribution record is written.</p>
 *
 * @since 0.1.0
 */
public final class IncompleteTransferException extends IOException {
  private static final long serialVersionUID = 1L;

  private final long bytesReceived;
  private final long declaredLength;

  /**
   * Creates an exception describing the short transfer.
   *
   * @param bytesReceived bytes written before the source ended
   * @param declaredLength bytes the client promised
   * @param cause read failure, or {@code null} for an orderly end of stream
   */
  public IncompleteTransferException(long bytesReceived, long declaredLength, Throwable cause) {
    super("payload ended after " + bytesReceived + " of " + declaredLength + " bytes", cause);
    this.bytesReceived = bytesReceived;
    this.declaredLength = declaredLength;
  }

  public long bytesReceived() {
    return bytesReceived;
  }

  public long declaredLength() {
    return declaredLength;
  }
}
