package ca.gc.cra.filedrop.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the server root, department directories, identity files,
 * and files selected for upload.
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @implNote Directory checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked department directory is
 * reported rather than silently followed.
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param allowedBase optional base directory; when non-null, {@code path} must reside within it
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return real path of the directory
   * @throws IllegalArgumentException if the path escapes {@code allowedBase}, is missing, is not a writable
   *     directory, or creation fails
   */
  public static Path validateWritableDir(Path path, Path allowedBase, boolean createIfMissing) {
    requireClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    Path base = allowedBase == null ? null : allowedBase.toAbsolutePath().normalize();
    ensureWithinBase(normalized, base);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
      if (!Files.isDirectory(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    requireClean(path);
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  private static void requireClean(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
  }

  private static void ensureWithinBase(Path candidate, Path base) {
    if (base != null && !candidate.startsWith(base)) {
      throw new IllegalArgumentException("path " + candidate + " escapes allowed base " + base);
    }
  }
}
