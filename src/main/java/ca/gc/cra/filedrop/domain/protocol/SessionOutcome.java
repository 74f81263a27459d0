package ca.gc.cra.filedrop.domain.protocol;

/**
 * Terminal state reached by a server-side session.
 *
 * @since 0.1.0
 */
public enum SessionOutcome {
  /** File stored and attributed; success reported to the client. */
  SUCCESS,
  /** Username missing, unknown, or outside both department groups. */
  UNAUTHENTICATED,
  /** Declared department did not match the authenticated department. */
  FORBIDDEN,
  /** Payload ended before the declared length; destination left partially written. */
  INCOMPLETE,
  /** Malformed, oversized, or truncated protocol field. */
  PROTOCOL_FAILURE,
  /** Destination could not be created or written. */
  IO_FAILURE
}
