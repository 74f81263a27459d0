package ca.gc.cra.filedrop.config;

import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentTransferWriter;
import ca.gc.cra.filedrop.validation.Net;
import ca.gc.cra.filedrop.validation.Numbers;
import ca.gc.cra.filedrop.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for the upload client. Username, file, and department are optional here; the CLI
 * prompts for whatever is missing.
 *
 * @param server server endpoint
 * @param username account name, if supplied
 * @param file local file, if supplied
 * @param department target department, if supplied
 * @param connectTimeoutMillis connect deadline; {@code 0} waits forever
 * @param readTimeoutMillis per-read deadline while awaiting responses; {@code 0} waits forever
 * @param chunkBytes payload bytes written per socket write
 * @since 0.1.0
 */
public record ClientConfig(
    Net.HostPort server,
    Optional<String> username,
    Optional<Path> file,
    Optional<Department> department,
    int connectTimeoutMillis,
    int readTimeoutMillis,
    int chunkBytes) {

  static final String DEFAULT_SERVER = "127.0.0.1:8080";
  private static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000;
  private static final int DEFAULT_READ_TIMEOUT_MILLIS = 60_000;
  private static final int MAX_TIMEOUT_MILLIS = 3_600_000;
  private static final int MIN_CHUNK_BYTES = 512;
  private static final int MAX_CHUNK_BYTES = 1_048_576;

  public ClientConfig {
    Objects.requireNonNull(server, "server");
    username = Objects.requireNonNullElse(username, Optional.empty());
    username.ifPresent(u -> Strings.requireMaxUtf8Bytes("user", u, ProtocolLimits.MAX_USERNAME_BYTES));
    file = Objects.requireNonNullElse(file, Optional.empty());
    department = Objects.requireNonNullElse(department, Optional.empty());
    Numbers.requireRange("connectTimeoutMillis", connectTimeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("readTimeoutMillis", readTimeoutMillis, 0, MAX_TIMEOUT_MILLIS);
    Numbers.requireRange("chunkBytes", chunkBytes, MIN_CHUNK_BYTES, MAX_CHUNK_BYTES);
  }

  /**
   * Provides defaults: server {@code 127.0.0.1:8080}, 10 s connect deadline, 60 s read deadline.
   *
   * @return default configuration
   */
  public static ClientConfig defaults() {
    return new ClientConfig(
        Net.parseHostPort("server", DEFAULT_SERVER),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        DEFAULT_CONNECT_TIMEOUT_MILLIS,
        DEFAULT_READ_TIMEOUT_MILLIS,
        DepartmentTransferWriter.DEFAULT_CHUNK_BYTES);
  }

  /**
   * Builds a configuration from merged {@code key=value} settings.
   *
   * @param args merged settings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ClientConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    ClientConfig defaults = defaults();
    Net.HostPort server = ConfigValues.optionalText(kv, "server")
        .map(v -> Net.parseHostPort("server", v))
        .orElse(defaults.server());
    return new ClientConfig(
        server,
        ConfigValues.optionalText(kv, "user"),
        ConfigValues.optionalPath(kv, "file"),
        ConfigValues.optionalText(kv, "department").map(Department::fromString),
        ConfigValues.boundedInt(
            kv, "connectTimeoutMillis", defaults.connectTimeoutMillis(), 0, MAX_TIMEOUT_MILLIS),
        ConfigValues.boundedInt(kv, "readTimeoutMillis", defaults.readTimeoutMillis(), 0, MAX_TIMEOUT_MILLIS),
        ConfigValues.boundedInt(kv, "chunkBytes", defaults.chunkBytes(), MIN_CHUNK_BYTES, MAX_CHUNK_BYTES));
  }
}
