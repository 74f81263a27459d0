package ca.gc.cra.filedrop.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each FILEDROP command.
 *
 * <p>Values mirror {@link ServerConfig#defaults()} and {@link ClientConfig#defaults()} so the merged map is
 * complete before YAML and CLI overrides are applied.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of("verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested command merged with common defaults.
   *
   * @param mode {@code server} or {@code upload}
   * @return unmodifiable map of defaults
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "server" -> serverDefaults();
      case "upload" -> uploadDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> serverDefaults() {
    ServerConfig defaults = ServerConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("port", Integer.toString(defaults.port()));
    map.put("bind", "");
    map.put("root", defaults.root().toString());
    map.put("backlog", Integer.toString(defaults.backlog()));
    map.put("readTimeoutMillis", Integer.toString(defaults.readTimeoutMillis()));
    map.put("chunkBytes", Integer.toString(defaults.chunkBytes()));
    map.put("identitySource", defaults.identitySource().name().toLowerCase(Locale.ROOT));
    map.put("passwdFile", defaults.passwdFile().toString());
    map.put("groupFile", defaults.groupFile().toString());
    map.put("identityFile", "");
    map.put("createRoots", "false");
    map.put("dryRun", "false");
    map.put("metricsExporter", defaults.metrics().exporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }

  private static Map<String, String> uploadDefaults() {
    ClientConfig defaults = ClientConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("server", defaults.server().toString());
    map.put("connectTimeoutMillis", Integer.toString(defaults.connectTimeoutMillis()));
    map.put("readTimeoutMillis", Integer.toString(defaults.readTimeoutMillis()));
    map.put("chunkBytes", Integer.toString(defaults.chunkBytes()));
    return map;
  }
}
