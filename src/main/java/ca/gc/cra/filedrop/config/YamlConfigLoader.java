package ca.gc.cra.filedrop.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional FILEDROP settings file.
 *
 * <p>The document holds at most three sections: {@code common}, {@code server} and {@code upload}. Each section
 * is a flat mapping of setting name to scalar, using the same names as the {@code key=value} arguments. The
 * command's own section wins over {@code common}. Passwords are never read from a file.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final List<String> COMMAND_SECTIONS = List.of("server", "upload");
  private static final String PASSWORD_KEY = "password";

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code command}.
   *
   * @param path location of the YAML file
   * @param command {@code server} or {@code upload} (case-insensitive)
   * @return flat settings map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the command is unknown or the document breaks the layout above
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!COMMAND_SECTIONS.contains(section)) {
      throw new IllegalArgumentException("no configuration section for command '" + command + "'");
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Map<String, Map<String, String>> sections = readSections(path);
    Map<String, String> settings = new LinkedHashMap<>(sections.getOrDefault(COMMON_SECTION, Map.of()));
    settings.putAll(sections.getOrDefault(section, Map.of()));
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<String, String>> readSections(Path path) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("configuration must be a mapping of sections");
    }

    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!name.equals(COMMON_SECTION) && !COMMAND_SECTIONS.contains(name)) {
        throw new IllegalArgumentException(
            "unknown section '" + entry.getKey() + "' (expected common, server or upload)");
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("section '" + name + "' appears more than once");
      }
      sections.put(name, settings(name, entry.getValue()));
    }
    return sections;
  }

  private static Map<String, String> settings(String section, Object node) {
    if (node == null) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(section + " section must be a mapping");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(section + " section contains a blank or non-string key");
      }
      if (key.trim().equalsIgnoreCase(PASSWORD_KEY)) {
        throw new IllegalArgumentException("passwords are not read from configuration files");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(section + "." + key + " must be a single value");
      }
      settings.put(key.trim(), value == null ? "" : value.toString());
    }
    return settings;
  }
}
