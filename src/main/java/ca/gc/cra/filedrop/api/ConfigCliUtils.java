package ca.gc.cra.filedrop.api;

import ca.gc.cra.filedrop.config.ConfigMerger;
import ca.gc.cra.filedrop.config.DefaultsForMode;
import ca.gc.cra.filedrop.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps for turning CLI arguments plus an optional YAML file into an effective settings map.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return configured path, or {@code null}
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }

  /**
   * Loads the YAML file (when named) and merges it with CLI values and defaults.
   *
   * @param mode command name
   * @param cliKv CLI settings without the {@code config} key
   * @param configPath YAML path or {@code null}
   * @param log logger receiving override warnings and errors
   * @param usage usage line printed on invalid input
   * @return effective settings
   * @throws CliAbort when the configuration cannot be loaded or merged
   */
  static Map<String, String> effectiveConfig(
      String mode, Map<String, String> cliKv, String configPath, Logger log, String usage) {
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }
    try {
      return ConfigMerger.buildEffectiveConfig(mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /** Carries an exit code out of a shared CLI step. */
  static final class CliAbort extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
