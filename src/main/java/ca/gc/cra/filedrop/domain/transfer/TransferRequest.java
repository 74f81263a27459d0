package ca.gc.cra.filedrop.domain.transfer;

import java.util.Objects;

/**
 * Upload metadata declared by the client ahead of the payload.
 *
 * <p>The department is kept exactly as received so authorization can compare it byte-for-byte against the
 * authenticated identity. The filename may carry directory components; only {@link #storedName()} is ever
 * used to build a destination path.</p>
 *
 * @param declaredDepartment department name as sent by the client
 * @param requestedFilename filename or path as sent by the client
 * @param declaredLength number of payload bytes that follow, in {@code [0, MAX_DECLARED_LENGTH]}
 * @since 0.1.0
 */
public record TransferRequest(String declaredDepartment, String requestedFilename, long declaredLength) {
  /** Largest length expressible by the 4-byte unsigned length field. */
  public static final long MAX_DECLARED_LENGTH = 0xFFFF_FFFFL;

  /**
   * Validates request fields.
   */
  public TransferRequest {
    Objects.requireNonNull(declaredDepartment, "declaredDepartment");
    Objects.requireNonNull(requestedFilename, "requestedFilename");
    if (declaredLength < 0 || declaredLength > MAX_DECLARED_LENGTH) {
      throw new IllegalArgumentException(
          "declaredLength must be between 0 and " + MAX_DECLARED_LENGTH + " (was " + declaredLength + ")");
    }
  }

  /**
   * Returns the final path component of the requested filename.
   *
   * @return basename used for the stored file and its attribution record
   * @throws IllegalArgumentException when the basename is empty, {@code .}, {@code ..}, or contains NUL
   */
  public String storedName() {
    return basename(requestedFilename);
  }

  /**
   * Strips every directory component from a client-supplied path. Both {@code /} and {@code \} count as
   * separators so Windows-style paths cannot smuggle directories through.
   *
   * @param path client-supplied filename or path
   * @return final path component
   * @throws IllegalArgumentException when no usable name remains
   */
  public static String basename(String path) {
    Objects.requireNonNull(path, "path");
    int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    String name = cut < 0 ? path : path.substring(cut + 1);
    if (name.isEmpty() || name.equals(".") || name.equals("..")) {
      throw new IllegalArgumentException("filename has no usable final component: '" + path + "'");
    }
    if (name.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("filename must not contain null bytes");
    }
    return name;
  }
}
