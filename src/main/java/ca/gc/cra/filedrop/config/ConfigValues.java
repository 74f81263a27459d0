package ca.gc.cra.filedrop.config;

import ca.gc.cra.filedrop.validation.Numbers;
import ca.gc.cra.filedrop.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Typed lookups over flattened {@code key=value} configuration maps.
 */
final class ConfigValues {
  private ConfigValues() {}

  static int boundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return (int) Numbers.requireRange(key, defaultValue, min, max);
    }
    return Numbers.parseInt(key, raw, min, max);
  }

  static boolean bool(Map<String, String> kv, String key, boolean fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(raw.trim());
  }

  static Path path(Map<String, String> kv, String key, Path fallback) {
    return optionalPath(kv, key).orElse(fallback);
  }

  static Optional<Path> optionalPath(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(key, raw)).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  static Optional<String> optionalText(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Strings.requireNonBlank(key, raw));
  }
}
