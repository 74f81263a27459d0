package ca.gc.cra.filedrop.domain.protocol;

import java.util.Objects;

/**
 * Server-to-client status frame: a status code plus a human-readable message.
 *
 * @param status status code driving client behaviour
 * @param message operator-facing text; keeps the historical success markers
 * @since 0.1.0
 */
public record Response(StatusCode status, String message) {
  /** Marker contained in every successful authentication message. */
  public static final String AUTH_SUCCESS_MARKER = "Authentication successful";
  /** Marker contained in every successful transfer message. */
  public static final String TRANSFER_SUCCESS_MARKER = "successfully transferred";

  /**
   * Validates frame fields.
   */
  public Response {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(message, "message");
  }

  public static Response authenticated(String department) {
    return new Response(StatusCode.OK, AUTH_SUCCESS_MARKER + ". Department: " + department);
  }

  public static Response userNotFound() {
    return new Response(StatusCode.AUTH_FAILED, "Authentication failed: User not found");
  }

  public static Response userNotInGroups() {
    return new Response(StatusCode.AUTH_FAILED, "Authentication failed: User not in required groups");
  }

  public static Response identityUnavailable() {
    return new Response(StatusCode.AUTH_FAILED, "Authentication failed: Identity lookup unavailable");
  }

  public static Response accessDenied(String declaredDepartment) {
    return new Response(
        StatusCode.ACCESS_DENIED,
        "Error: You don't have access to the " + declaredDepartment + " department");
  }

  public static Response malformed(String reason) {
    return new Response(StatusCode.PROTOCOL_ERROR, "Error: Malformed request: " + reason);
  }

  public static Response invalidFilename() {
    return new Response(StatusCode.PROTOCOL_ERROR, "Error: Invalid filename");
  }

  public static Response cannotCreate(String reason) {
    return new Response(StatusCode.IO_ERROR, "Error: Cannot create file: " + reason);
  }

  public static Response writeFailed(String reason) {
    return new Response(StatusCode.IO_ERROR, "Error: File transfer failed: " + reason);
  }

  public static Response ready(long declaredLength) {
    return new Response(StatusCode.READY, "Ready to receive " + declaredLength + " bytes");
  }

  public static Response transferred(String storedName, String department) {
    return new Response(
        StatusCode.OK,
        "File '" + storedName + "' " + TRANSFER_SUCCESS_MARKER + " to " + department + " department");
  }

  /**
   * Indicates whether the frame reports success for its step.
   *
   * @return {@code true} for {@link StatusCode#OK} and {@link StatusCode#READY}
   */
  public boolean isSuccess() {
    return status == StatusCode.OK || status == StatusCode.READY;
  }
}
