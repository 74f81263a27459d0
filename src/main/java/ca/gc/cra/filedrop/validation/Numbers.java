package ca.gc.cra.filedrop.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by FILEDROP CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects out-of-range ports, backlogs, timeouts, and chunk sizes before sockets or
 * buffers are allocated.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param text candidate text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is missing, not numeric, or out of range
   */
  public static int parseInt(String name, String text, int min, int max) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    int value;
    try {
      value = Integer.parseInt(text.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + text.trim() + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
