package ca.gc.cra.filedrop.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.infrastructure.net.UploadResult;
import ca.gc.cra.filedrop.testutil.RecordingMetricsPort;
import ca.gc.cra.filedrop.testutil.RunningServer;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@Timeout(30)
class UploadCliTest {
  @TempDir Path storage;
  @TempDir Path work;

  private RunningServer server;
  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() throws IOException {
    server = RunningServer.start(storage.resolve("fileserver"), work, new RecordingMetricsPort());
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(UploadCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    server.close();
  }

  @Test
  void uploadsWithArgumentsAndPromptedPassword() throws IOException {
    Path file = Files.writeString(work.resolve("batch-42.csv"), "part,qty\nbolt,500\n");
    ScriptedPrompter prompter = new ScriptedPrompter("s3cret");

    ExitCode code = UploadCli.run(new String[] {
        "server=127.0.0.1:" + server.port(), "user=mfg1", "file=" + file, "department=Manufacturing"}, prompter);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Password: "), prompter.prompts);
    assertEquals("part,qty\nbolt,500\n",
        Files.readString(server.departmentDir("Manufacturing").resolve("batch-42.csv")));
    String output = buffer.toString();
    assertTrue(output.contains("Uploading: 100%"));
    assertTrue(output.contains(Response.TRANSFER_SUCCESS_MARKER));
  }

  @Test
  void promptsForEverythingMissingAndRepromptsDepartment() throws IOException {
    Path file = Files.writeString(work.resolve("manifest.txt"), "pallets: 12");
    ScriptedPrompter prompter = new ScriptedPrompter("pw", "dist1", file.toString(), "9", "2");

    ExitCode code = UploadCli.run(new String[] {"server=127.0.0.1:" + server.port()}, prompter);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("Username: ", "Password: ", "File path: ", "Choice [1-2]: ", "Choice [1-2]: "),
        prompter.prompts);
    assertTrue(buffer.toString().contains("Invalid choice '9'; enter 1 or 2."));
    assertTrue(Files.exists(server.departmentDir("Distribution").resolve("manifest.txt")));
  }

  @Test
  void deniedDepartmentIsRejected() throws IOException {
    Path file = Files.writeString(work.resolve("plan.txt"), "x");

    ExitCode code = UploadCli.run(new String[] {
        "server=127.0.0.1:" + server.port(), "user=dist1", "file=" + file, "department=1"},
        new ScriptedPrompter("pw"));

    assertEquals(ExitCode.TRANSFER_REJECTED, code);
    assertFalse(Files.exists(server.departmentDir("Manufacturing").resolve("plan.txt")));
  }

  @Test
  void unknownUserIsRejected() throws IOException {
    Path file = Files.writeString(work.resolve("plan.txt"), "x");

    ExitCode code = UploadCli.run(new String[] {
        "server=127.0.0.1:" + server.port(), "user=nobody", "file=" + file, "department=2"},
        new ScriptedPrompter("pw"));

    assertEquals(ExitCode.TRANSFER_REJECTED, code);
  }

  @Test
  void rejectedLoginIsNeverAskedForFileOrDepartment() throws IOException {
    Path file = Files.writeString(work.resolve("plan.txt"), "x");
    ScriptedPrompter prompter = new ScriptedPrompter("pw", "nobody", file.toString(), "1");

    ExitCode code = UploadCli.run(new String[] {"server=127.0.0.1:" + server.port()}, prompter);

    assertEquals(ExitCode.TRANSFER_REJECTED, code);
    assertEquals(List.of("Username: ", "Password: "), prompter.prompts);
    assertTrue(buffer.toString().contains("Authentication failed"));
  }

  @Test
  void inputEndingAfterLoginCancelsWithoutStoringAnything() throws IOException {
    ScriptedPrompter prompter = new ScriptedPrompter("pw", "mfg1");

    ExitCode code = UploadCli.run(new String[] {"server=127.0.0.1:" + server.port()}, prompter);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertEquals(List.of("Username: ", "Password: ", "File path: "), prompter.prompts);
    try (var entries = Files.list(server.departmentDir("Manufacturing"))) {
      assertEquals(0, entries.count());
    }
  }

  @Test
  void passwordArgumentIsRefusedAndNeverLogged() {
    ExitCode code = UploadCli.run(new String[] {"user=mfg1", "password=hunter2"}, new ScriptedPrompter(null));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().noneMatch(event -> event.getFormattedMessage().contains("hunter2")));
    assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("[REDACTED]")));
  }

  @Test
  void serverOnlySwitchIsRejected() {
    ScriptedPrompter prompter = new ScriptedPrompter("pw");

    ExitCode code = UploadCli.run(new String[] {"server=127.0.0.1:" + server.port(), "--dry-run"}, prompter);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(prompter.prompts.isEmpty());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Unknown upload option(s): [--dry-run]")));
  }

  @Test
  void missingFileIsInvalidArgs() {
    ExitCode code = UploadCli.run(new String[] {
        "server=127.0.0.1:" + server.port(), "user=mfg1", "file=" + work.resolve("absent.bin"), "department=1"},
        new ScriptedPrompter("pw"));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void endOfInputIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        UploadCli.run(new String[] {"server=127.0.0.1:" + server.port()}, new ScriptedPrompter(null)));
  }

  @Test
  void unreachableServerIsIoError() throws IOException {
    int closedPort;
    try (ServerSocket reserved = new ServerSocket(0)) {
      closedPort = reserved.getLocalPort();
    }
    Path file = Files.writeString(work.resolve("plan.txt"), "x");

    ExitCode code = UploadCli.run(new String[] {
        "server=127.0.0.1:" + closedPort, "user=mfg1", "file=" + file, "department=1"},
        new ScriptedPrompter("pw"));

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(buffer.toString().contains("Connection to 127.0.0.1:" + closedPort + " failed"));
  }

  @Test
  void promptDepartmentAcceptsNamesCaseInsensitively() {
    assertEquals(Optional.of(Department.MANUFACTURING),
        UploadCli.promptDepartment(new ScriptedPrompter(null, "manufacturing")));
    assertEquals(Optional.empty(), UploadCli.promptDepartment(new ScriptedPrompter(null, "3")));
  }

  @Test
  void exitCodesSeparateRejectionFromTransportFailure() {
    assertEquals(ExitCode.SUCCESS, UploadCli.exitCodeFor(result(UploadResult.Status.SUCCESS)));
    assertEquals(ExitCode.TRANSFER_REJECTED, UploadCli.exitCodeFor(result(UploadResult.Status.AUTH_FAILED)));
    assertEquals(ExitCode.TRANSFER_REJECTED, UploadCli.exitCodeFor(result(UploadResult.Status.ACCESS_DENIED)));
    assertEquals(ExitCode.TRANSFER_REJECTED, UploadCli.exitCodeFor(result(UploadResult.Status.SERVER_ERROR)));
    assertEquals(ExitCode.IO_ERROR, UploadCli.exitCodeFor(result(UploadResult.Status.CONNECT_FAILURE)));
    assertEquals(ExitCode.IO_ERROR, UploadCli.exitCodeFor(result(UploadResult.Status.PROTOCOL_FAILURE)));
    assertEquals(ExitCode.INVALID_ARGS, UploadCli.exitCodeFor(result(UploadResult.Status.CANCELLED)));
  }

  private static UploadResult result(UploadResult.Status status) {
    return new UploadResult(status, "", 0);
  }

  /** Replays a password followed by line answers; empty once the script runs out. */
  private static final class ScriptedPrompter implements Prompter {
    private final String secret;
    private final Deque<String> lines = new ArrayDeque<>();
    private final List<String> prompts = new ArrayList<>();

    ScriptedPrompter(String secret, String... lines) {
      this.secret = secret;
      this.lines.addAll(List.of(lines));
    }

    @Override
    public Optional<String> readLine(String prompt) {
      prompts.add(prompt);
      return Optional.ofNullable(lines.pollFirst());
    }

    @Override
    public Optional<String> readSecret(String prompt) {
      prompts.add(prompt);
      return Optional.ofNullable(secret);
    }
  }
}
