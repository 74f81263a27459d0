package ca.gc.cra.filedrop.domain.protocol;

/**
 * <strong>What:</strong> Status byte carried by every server response frame.
 * <p><strong>Why:</strong> Lets clients branch on an explicit code instead of scanning human-readable text.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum StatusCode {
  /** Step succeeded (authentication or final transfer). */
  OK(0),
  /** Destination is open; the client may stream the payload. */
  READY(1),
  /** Unknown account or account outside both department groups. */
  AUTH_FAILED(2),
  /** Declared department differs from the authenticated department. */
  ACCESS_DENIED(3),
  /** Destination could not be created or written. */
  IO_ERROR(4),
  /** Malformed or unusable request field. */
  PROTOCOL_ERROR(5);

  private final int wireValue;

  StatusCode(int wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the single-byte value written on the wire.
   *
   * @return unsigned byte value
   */
  public int wireValue() {
    return wireValue;
  }

  /**
   * Decodes a wire byte.
   *
   * @param value unsigned byte read from the wire
   * @return matching status code
   * @throws IllegalArgumentException when the value is unknown
   */
  public static StatusCode fromWire(int value) {
    for (StatusCode code : values()) {
      if (code.wireValue == value) {
        return code;
      }
    }
    throw new IllegalArgumentException("unknown status code " + value);
  }
}
