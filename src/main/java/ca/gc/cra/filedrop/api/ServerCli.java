package ca.gc.cra.filedrop.api;

import ca.gc.cra.filedrop.config.CompositionRoot;
import ca.gc.cra.filedrop.config.ServerConfig;
import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.infrastructure.net.ConnectionDispatcher;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentDirectories;
import ca.gc.cra.filedrop.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the upload server.
 *
 * @since 0.1.0
 */
public final class ServerCli {
  private static final Logger log = LoggerFactory.getLogger(ServerCli.class);
  private static final String MODE_SERVER = "server";
  private static final String SUMMARY_USAGE =
      "usage: server [port=1-65535] [bind=ADDR] [root=PATH] [backlog=1-4096] [readTimeoutMillis=0-3600000] "
          + "[chunkBytes=512-1048576] [identitySource=etc|yaml] [passwdFile=PATH] [groupFile=PATH] "
          + "[identityFile=PATH] [config=YAML] [--create-roots] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      FILEDROP upload server

      Usage:
        server [options]

      Optional (validated):
        port=1-65535                TCP port (default 8080)
        bind=ADDR                   Listen address (default: all interfaces)
        root=PATH                   Server root holding Manufacturing/ and Distribution/ (default /tmp/fileserver)
        backlog=1-4096              Pending-connection queue length (default 10)
        readTimeoutMillis=0-3600000 Per-read deadline for clients; 0 waits forever (default 60000)
        chunkBytes=512-1048576      Payload copy chunk size (default 8192)
        identitySource=etc|yaml     Account database (default etc)
        passwdFile=PATH             Account file for identitySource=etc (default /etc/passwd)
        groupFile=PATH              Group file for identitySource=etc (default /etc/group)
        identityFile=PATH           Account fixture for identitySource=yaml
        config=PATH                 YAML file with common/server sections
        metricsExporter=otlp|none   Configure metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --create-roots              Create missing department directories
        --dry-run                   Validate inputs and print the plan without listening
        --verbose                   Enable DEBUG logging for troubleshooting
        --help                      Show this message

      Notes:
        Passwords are accepted but never verified.
        Department membership comes from groups named Manufacturing and Distribution.
      """;

  private ServerCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the server command and returns a standardized exit code. Blocks while the server runs.
   *
   * @param args raw CLI arguments
   * @return exit code that callers can inspect
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for server CLI");
    }

    List<String> unsupported = input.unsupported(CliInput.Switch.CREATE_ROOTS, CliInput.Switch.DRY_RUN);
    if (!unsupported.isEmpty()) {
      log.error("Unknown server option(s): {}", unsupported);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    cliKv.putAll(input.switchSettings());

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE_SERVER, cliKv, configPath, log, SUMMARY_USAGE);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }
    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");

    ServerConfig config;
    try {
      config = ServerConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid server arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.info("Configured server: port={}, root={}, identitySource={}, metricsExporter={}",
        config.port(), config.root(), config.identitySource(), config.metrics().exporter());

    if (dryRun) {
      CliPrinter.printLines(dryRunPlan(config).toArray(String[]::new));
      return ExitCode.SUCCESS;
    }
    return serve(config);
  }

  static List<String> dryRunPlan(ServerConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("FILEDROP server dry-run");
    lines.add("  listen: " + config.bindAddress().orElse("*") + ":" + config.port()
        + " (backlog " + config.backlog() + ")");
    lines.add("  readTimeoutMillis: " + config.readTimeoutMillis());
    lines.add("  chunkBytes: " + config.chunkBytes());
    lines.add("  root: " + config.root());
    DepartmentDirectories directories = new DepartmentDirectories(config.root());
    for (Department department : Department.values()) {
      Path dir = directories.resolve(department);
      String state;
      if (Files.isDirectory(dir)) {
        state = "exists";
      } else if (config.createRoots()) {
        state = "missing (will be created)";
      } else {
        state = "missing";
      }
      lines.add("  " + department.displayName() + ": " + dir + " [" + state + "]");
    }
    lines.add("  identity: " + switch (config.identitySource()) {
      case ETC -> "etc (" + config.passwdFile() + ", " + config.groupFile() + ")";
      case YAML -> "yaml (" + config.identityFile().orElseThrow() + ")";
    });
    lines.add("  metrics: " + config.metrics().exporter());
    lines.add("No socket was opened and no directory was created.");
    return lines;
  }

  private static ExitCode serve(ServerConfig config) {
    try (CompositionRoot root = new CompositionRoot(config)) {
      ConnectionDispatcher dispatcher = root.connectionDispatcher();
      Thread hook = new Thread(dispatcher::close, "filedrop-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      dispatcher.serve();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Server I/O failure on port {}", config.port(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Server configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in server", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
