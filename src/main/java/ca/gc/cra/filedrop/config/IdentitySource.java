package ca.gc.cra.filedrop.config;

import java.util.Locale;

/**
 * Backing store consulted for host accounts and department groups.
 */
public enum IdentitySource {
  /** {@code passwd}/{@code group} format files, by default {@code /etc/passwd} and {@code /etc/group}. */
  ETC,
  /** YAML fixture named by {@code identityFile}. */
  YAML;

  /**
   * Parses a case-insensitive source name.
   *
   * @param value raw value; blank selects {@link #ETC}
   * @return parsed source
   * @throws IllegalArgumentException for unknown names
   */
  public static IdentitySource fromString(String value) {
    if (value == null || value.isBlank()) {
      return ETC;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "etc" -> ETC;
      case "yaml" -> YAML;
      default -> throw new IllegalArgumentException("identitySource must be etc or yaml (was " + value.trim() + ")");
    };
  }
}
