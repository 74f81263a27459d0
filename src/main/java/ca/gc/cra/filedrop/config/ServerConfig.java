package ca.gc.cra.filedrop.config;

import ca.gc.cra.filedrop.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentTransferWriter;
import ca.gc.cra.filedrop.validation.Net;
import ca.gc.cra.filedrop.validation.Numbers;
import ca.gc.cra.filedrop.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for the upload server.
 * <p><strong>Why:</strong> Validates network, storage, identity, and telemetry knobs once at startup so the
 * accept loop never sees an invalid value.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param port TCP port; {@code 0} picks an ephemeral port
 * @param bindAddress listen address; empty binds every interface
 * @param root server root holding the department directories
 * @param backlog pending-connection queue length
 * @param readTimeoutMillis per-read deadline for client sockets; {@code 0} waits forever
 * @param chunkBytes payload copy chunk size
 * @param identitySource account and group backing store
 * @param passwdFile account database used by {@link IdentitySource#ETC}
 * @param groupFile group database used by {@link IdentitySource#ETC}
 * @param identityFile fixture used by {@link IdentitySource#YAML}
 * @param createRoots create missing department directories at startup
 * @param metrics OpenTelemetry exporter selection
 * @since 0.1.0
 */
public record ServerConfig(
    int port,
    Optional<String> bindAddress,
    Path root,
    int backlog,
    int readTimeoutMillis,
    int chunkBytes,
    IdentitySource identitySource,
    Path passwdFile,
    Path groupFile,
    Optional<Path> identityFile,
    boolean createRoots,
    MetricsSettings metrics) {

  static final int DEFAULT_PORT = 8080;
  static final Path DEFAULT_ROOT = Path.of("/tmp/fileserver");
  static final int DEFAULT_BACKLOG = 10;
  static final int DEFAULT_READ_TIMEOUT_MILLIS = 60_000;
  private static final int MAX_BACKLOG = 4_096;
  private static final int MAX_READ_TIMEOUT_MILLIS = 3_600_000;
  private static final int MIN_CHUNK_BYTES = 512;
  private static final int MAX_CHUNK_BYTES = 1_048_576;
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /**
   * Validates settings and cross-field requirements.
   */
  public ServerConfig {
    Numbers.requireRange("port", port, 0, 65_535);
    bindAddress = Objects.requireNonNullElse(bindAddress, Optional.empty());
    Objects.requireNonNull(root, "root");
    Numbers.requireRange("backlog", backlog, 1, MAX_BACKLOG);
    Numbers.requireRange("readTimeoutMillis", readTimeoutMillis, 0, MAX_READ_TIMEOUT_MILLIS);
    Numbers.requireRange("chunkBytes", chunkBytes, MIN_CHUNK_BYTES, MAX_CHUNK_BYTES);
    Objects.requireNonNull(identitySource, "identitySource");
    Objects.requireNonNull(passwdFile, "passwdFile");
    Objects.requireNonNull(groupFile, "groupFile");
    identityFile = Objects.requireNonNullElse(identityFile, Optional.empty());
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
    if (identitySource == IdentitySource.YAML && identityFile.isEmpty()) {
      throw new IllegalArgumentException("identityFile is required when identitySource=yaml");
    }
  }

  /**
   * Provides defaults matching the historical deployment: port 8080 on every interface, root
   * {@code /tmp/fileserver}, host identity files, OTLP metrics.
   *
   * @return default configuration
   */
  public static ServerConfig defaults() {
    return new ServerConfig(
        DEFAULT_PORT,
        Optional.empty(),
        DEFAULT_ROOT,
        DEFAULT_BACKLOG,
        DEFAULT_READ_TIMEOUT_MILLIS,
        DepartmentTransferWriter.DEFAULT_CHUNK_BYTES,
        IdentitySource.ETC,
        Path.of("/etc/passwd"),
        Path.of("/etc/group"),
        Optional.empty(),
        false,
        new MetricsSettings("otlp", "", ""));
  }

  /**
   * Builds a configuration from merged {@code key=value} settings.
   *
   * @param args merged settings; missing keys fall back to {@link #defaults()}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ServerConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    ServerConfig defaults = defaults();

    int port = ConfigValues.boundedInt(kv, "port", defaults.port(), 1, 65_535);
    Optional<String> bind = ConfigValues.optionalText(kv, "bind").map(v -> Net.validateBindAddress("bind", v));
    Path root = ConfigValues.path(kv, "root", defaults.root());
    int backlog = ConfigValues.boundedInt(kv, "backlog", defaults.backlog(), 1, MAX_BACKLOG);
    int readTimeout = ConfigValues.boundedInt(
        kv, "readTimeoutMillis", defaults.readTimeoutMillis(), 0, MAX_READ_TIMEOUT_MILLIS);
    int chunkBytes = ConfigValues.boundedInt(
        kv, "chunkBytes", defaults.chunkBytes(), MIN_CHUNK_BYTES, MAX_CHUNK_BYTES);
    IdentitySource source = IdentitySource.fromString(kv.get("identitySource"));
    Path passwd = ConfigValues.path(kv, "passwdFile", defaults.passwdFile());
    Path group = ConfigValues.path(kv, "groupFile", defaults.groupFile());
    Optional<Path> identityFile = ConfigValues.optionalPath(kv, "identityFile");
    boolean createRoots = ConfigValues.bool(kv, "createRoots", false);

    String exporter = Strings.requireOneOf(
        "metricsExporter", kv.getOrDefault("metricsExporter", "otlp"), Set.of("otlp", "none"));
    String endpoint = ConfigValues.optionalText(kv, "otelEndpoint")
        .map(v -> Net.requireHttpEndpoint("otelEndpoint", v))
        .orElse("");
    String attributes = ConfigValues.optionalText(kv, "otelResourceAttributes").orElse("");
    if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(
          "otelResourceAttributes must be at most " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
    }

    return new ServerConfig(
        port,
        bind,
        root,
        backlog,
        readTimeout,
        chunkBytes,
        source,
        passwd,
        group,
        identityFile,
        createRoots,
        new MetricsSettings(exporter, endpoint, attributes));
  }

  /**
   * Returns a copy listening on {@code newPort}.
   *
   * @param newPort TCP port; {@code 0} picks an ephemeral port
   * @return updated configuration
   */
  public ServerConfig withPort(int newPort) {
    return new ServerConfig(newPort, bindAddress, root, backlog, readTimeoutMillis, chunkBytes,
        identitySource, passwdFile, groupFile, identityFile, createRoots, metrics);
  }
}
