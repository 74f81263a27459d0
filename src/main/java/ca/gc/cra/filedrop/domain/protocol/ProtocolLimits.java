package ca.gc.cra.filedrop.domain.protocol;

/**
 * Upper bounds, in UTF-8 bytes, for each length-prefixed text field.
 *
 * @since 0.1.0
 */
public final class ProtocolLimits {
  /** Maximum username bytes. */
  public static final int MAX_USERNAME_BYTES = 32;
  /** Maximum password bytes. */
  public static final int MAX_PASSWORD_BYTES = 32;
  /** Maximum department name bytes. */
  public static final int MAX_DEPARTMENT_BYTES = 32;
  /** Maximum filename or path bytes. */
  public static final int MAX_FILENAME_BYTES = 256;
  /** Maximum server message bytes. */
  public static final int MAX_MESSAGE_BYTES = 1_024;
  /** Largest value representable by the two-byte field length prefix. */
  public static final int MAX_FIELD_PREFIX = 0xFFFF;

  private ProtocolLimits() {}
}
