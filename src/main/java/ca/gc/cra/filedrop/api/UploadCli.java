package ca.gc.cra.filedrop.api;

import ca.gc.cra.filedrop.config.ClientConfig;
import ca.gc.cra.filedrop.config.CompositionRoot;
import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import ca.gc.cra.filedrop.infrastructure.net.ProgressListener;
import ca.gc.cra.filedrop.infrastructure.net.TransferPlanner;
import ca.gc.cra.filedrop.infrastructure.net.UploadClient;
import ca.gc.cra.filedrop.infrastructure.net.UploadResult;
import ca.gc.cra.filedrop.logging.LoggingConfigurator;
import ca.gc.cra.filedrop.logging.Logs;
import ca.gc.cra.filedrop.validation.Paths;
import ca.gc.cra.filedrop.validation.Strings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for uploading one file to a FILEDROP server. Prompts for anything not given as an argument; the
 * file and department prompts follow a successful login.
 *
 * @since 0.1.0
 */
public final class UploadCli {
  private static final Logger log = LoggerFactory.getLogger(UploadCli.class);
  private static final String MODE_UPLOAD = "upload";
  private static final String SUMMARY_USAGE =
      "usage: upload [server=HOST:PORT] [user=NAME] [file=PATH] [department=Manufacturing|Distribution|1|2] "
          + "[connectTimeoutMillis=MS] [readTimeoutMillis=MS] [chunkBytes=512-1048576] [config=YAML]";
  private static final String HELP_TEXT = """
      FILEDROP upload client

      Usage:
        upload [options]

      Optional (prompted when missing):
        user=NAME                   Account name (at most 32 bytes)
        file=PATH                   Local regular file to send (at most 4 GiB - 1)
        department=NAME|1|2         Manufacturing (1) or Distribution (2)

      Optional (validated):
        server=HOST:PORT            Server endpoint (default 127.0.0.1:8080)
        connectTimeoutMillis=MS     Connect deadline; 0 waits forever (default 10000)
        readTimeoutMillis=MS        Response deadline, not applied to READY; 0 waits forever (default 60000)
        chunkBytes=512-1048576      Bytes written per socket write (default 8192)
        config=PATH                 YAML file with common/upload sections
        --verbose                   Enable DEBUG logging for troubleshooting
        --help                      Show this message

      Notes:
        The password is always prompted and is never accepted as an argument.
        The server stores the file under its basename and overwrites an existing file.
      """;
  private static final String DEPARTMENT_MENU = """
      Select department:
        1. Manufacturing
        2. Distribution""";

  private UploadCli() {}

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
   * Executes the upload command against the system console.
   *
   * @param args raw CLI arguments
   * @return exit code that callers can inspect
   */
  static ExitCode run(String[] args) {
    return run(args, new ConsolePrompter());
  }

  static ExitCode run(String[] args, Prompter prompter) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for upload CLI");
    }

    List<String> unsupported = input.unsupported();
    if (!unsupported.isEmpty()) {
      log.error("Unknown upload option(s): {}", unsupported);
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
    if (cliKv.containsKey("password")) {
      log.error("Passwords are not accepted as arguments; omit password={}",
          Logs.redact(cliKv.get("password")));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String configPath = ConfigCliUtils.extractConfigPath(cliKv);

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE_UPLOAD, cliKv, configPath, log, SUMMARY_USAGE);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }

    ClientConfig config;
    try {
      config = ClientConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid upload arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Credentials credentials;
    try {
      credentials = collect(config, prompter);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid upload input: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (UncheckedIOException ex) {
      log.error("Unable to read interactive input", ex);
      return ExitCode.IO_ERROR;
    }
    if (credentials == null) {
      log.error("Input ended before all upload details were entered");
      return ExitCode.INVALID_ARGS;
    }

    return execute(config, credentials, prompter);
  }

  private static Credentials collect(ClientConfig config, Prompter prompter) {
    config.file().ifPresent(UploadCli::requireUploadable);
    Optional<String> username = config.username().or(() -> prompter.readLine("Username: "));
    if (username.isEmpty()) {
      return null;
    }
    Strings.requireMaxUtf8Bytes("user", username.get(), ProtocolLimits.MAX_USERNAME_BYTES);

    Optional<String> password = prompter.readSecret("Password: ");
    if (password.isEmpty()) {
      return null;
    }
    Strings.requireMaxUtf8Bytes("password", password.get(), ProtocolLimits.MAX_PASSWORD_BYTES);
    return new Credentials(username.get(), password.get());
  }

  /** Asks for the file and department only after the server has accepted the account. */
  private static TransferPlanner plannerFor(ClientConfig config, Credentials credentials, Prompter prompter) {
    return authenticated -> {
      Optional<Path> file = config.file().or(() -> prompter.readLine("File path: ")
          .map(String::trim)
          .map(Path::of));
      if (file.isEmpty()) {
        return Optional.empty();
      }
      long size = requireUploadable(file.get());
      Optional<Department> department = config.department().or(() -> promptDepartment(prompter));
      if (department.isEmpty()) {
        return Optional.empty();
      }
      log.info("Uploading {} ({} bytes) to {} as {} for {}",
          file.get(), size, config.server(), Logs.truncate(credentials.username(), 32), department.get());
      return Optional.of(TransferPlanner.Transfer.of(department.get().displayName(), file.get()));
    };
  }

  private static long requireUploadable(Path file) {
    Path local = Paths.requireReadableFile("file", file);
    long size;
    try {
      size = Files.size(local);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to size " + local + ": " + ex.getMessage(), ex);
    }
    if (size > TransferRequest.MAX_DECLARED_LENGTH) {
      throw new IllegalArgumentException(
          "file is too large: " + size + " bytes (max " + TransferRequest.MAX_DECLARED_LENGTH + ")");
    }
    return size;
  }

  static Optional<Department> promptDepartment(Prompter prompter) {
    CliPrinter.println(DEPARTMENT_MENU);
    while (true) {
      Optional<String> choice = prompter.readLine("Choice [1-2]: ");
      if (choice.isEmpty()) {
        return Optional.empty();
      }
      try {
        return Optional.of(Department.fromString(choice.get()));
      } catch (IllegalArgumentException ex) {
        CliPrinter.println("Invalid choice '" + Logs.truncate(choice.get(), 32) + "'; enter 1 or 2.");
      }
    }
  }

  private static ExitCode execute(ClientConfig config, Credentials credentials, Prompter prompter) {
    UploadClient client = CompositionRoot.uploadClient(config);
    log.debug("Connecting to {} as {}", config.server(), Logs.truncate(credentials.username(), 32));
    UploadResult result;
    try {
      result = client.upload(
          credentials.username(),
          credentials.password(),
          plannerFor(config, credentials, prompter),
          new ConsoleProgress());
    } catch (IOException ex) {
      log.error("Local I/O failure during upload", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid upload input: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during upload", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    if (result.status() == UploadResult.Status.CANCELLED) {
      log.error("Input ended before all upload details were entered");
    }
    CliPrinter.println(result.message());
    return exitCodeFor(result);
  }

  static ExitCode exitCodeFor(UploadResult result) {
    return switch (result.status()) {
      case SUCCESS -> ExitCode.SUCCESS;
      case AUTH_FAILED, ACCESS_DENIED, SERVER_ERROR -> ExitCode.TRANSFER_REJECTED;
      case CONNECT_FAILURE, PROTOCOL_FAILURE, IO_FAILURE -> ExitCode.IO_ERROR;
      case CANCELLED -> ExitCode.INVALID_ARGS;
    };
  }

  private record Credentials(String username, String password) {
    @Override
    public String toString() {
      return "Credentials[username=" + username + ", password=" + Logs.redact(password) + "]";
    }
  }

  /** Prints the server's frames and an in-place percentage. */
  private static final class ConsoleProgress implements ProgressListener {
    private int lastPercent = -1;

    @Override
    public void onResponse(Response response) {
      if (lastPercent >= 0) {
        CliPrinter.println("");
        lastPercent = -1;
      }
      log.debug("Server responded {}: {}", response.status(), Logs.truncate(response.message(), 256));
    }

    @Override
    public void onProgress(long sent, long total) {
      int percent = ProgressListener.percent(sent, total);
      if (percent != lastPercent) {
        lastPercent = percent;
        CliPrinter.print("\rUploading: " + percent + "%");
      }
    }
  }
}
