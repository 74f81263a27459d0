package ca.gc.cra.filedrop.domain.identity;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> The two authorization scopes an uploader may write into.
 * <p><strong>Why:</strong> Department names double as host group names, wire tokens, and storage directory
 * names, so a single enum keeps the three in lock-step.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by the identity resolver, the session protocol, and the
 * transfer writer.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum Department {
  /** Manufacturing department; wins when an account belongs to both groups. */
  MANUFACTURING("Manufacturing"),
  /** Distribution department. */
  DISTRIBUTION("Distribution");

  private final String displayName;

  Department(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the canonical name used on the wire, as the host group name, and as the directory name.
   *
   * @return canonical department name
   */
  public String displayName() {
    return displayName;
  }

  /**
   * Matches a wire token byte-for-byte against the canonical department names.
   *
   * @param wireName department name exactly as received; may be {@code null}
   * @return matching department, or empty when the token is not an exact canonical name
   */
  public static Optional<Department> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    for (Department department : values()) {
      if (department.displayName.equals(wireName)) {
        return Optional.of(department);
      }
    }
    return Optional.empty();
  }

  /**
   * Parses operator input leniently: canonical names in any case, or the menu numbers {@code 1}/{@code 2}.
   *
   * @param value raw operator input; {@code null} or blank is rejected
   * @return parsed department
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static Department fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("department must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "1", "MANUFACTURING" -> MANUFACTURING;
      case "2", "DISTRIBUTION" -> DISTRIBUTION;
      default -> throw new IllegalArgumentException(
          "department must be one of Manufacturing or Distribution (was " + value + ")");
    };
  }

  @Override
  public String toString() {
    return displayName;
  }
}
