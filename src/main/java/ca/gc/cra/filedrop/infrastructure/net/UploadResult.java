package ca.gc.cra.filedrop.infrastructure.net;

import java.util.Objects;

/**
 * Outcome of one client upload attempt.
 *
 * @param status terminal status
 * @param message server message, or a local description when the server sent none
 * @param bytesSent payload bytes written to the socket
 * @since 0.1.0
 */
public record UploadResult(Status status, String message, long bytesSent) {

  /** Terminal client states. */
  public enum Status {
    SUCCESS,
    CONNECT_FAILURE,
    AUTH_FAILED,
    ACCESS_DENIED,
    SERVER_ERROR,
    PROTOCOL_FAILURE,
    IO_FAILURE,
    /** Authenticated, then closed by the caller before a transfer was requested. */
    CANCELLED
  }

  public UploadResult {
    Objects.requireNonNull(status, "status");
    message = message == null ? "" : message;
  }

  public boolean succeeded() {
    return status == Status.SUCCESS;
  }
}
