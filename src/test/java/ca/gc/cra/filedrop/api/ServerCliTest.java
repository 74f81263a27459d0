package ca.gc.cra.filedrop.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.filedrop.config.ServerConfig;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ServerCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ServerCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunPrintsPlanWithoutCreatingDirectories() {
    Path root = tempDir.resolve("fileserver");

    ExitCode code = ServerCli.run(new String[] {
        "root=" + root, "port=9090", "metricsExporter=none", "--create-roots", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("FILEDROP server dry-run"));
    assertTrue(output.contains("listen: *:9090"));
    assertTrue(output.contains("Manufacturing: " + root.resolve("Manufacturing") + " [missing (will be created)]"));
    assertTrue(output.contains("No socket was opened"));
    assertFalse(Files.exists(root));
  }

  @Test
  void dryRunPlanReportsExistingDirectories() throws Exception {
    Path root = tempDir.resolve("fileserver");
    Files.createDirectories(root.resolve("Distribution"));
    ServerConfig config = ServerConfig.fromMap(Map.of("root", root.toString(), "metricsExporter", "none"));

    List<String> plan = ServerCli.dryRunPlan(config);

    assertTrue(plan.contains("  Distribution: " + root.resolve("Distribution") + " [exists]"));
    assertTrue(plan.contains("  Manufacturing: " + root.resolve("Manufacturing") + " [missing]"));
    assertTrue(plan.contains("  metrics: none"));
  }

  @Test
  void invalidPortReturnsInvalidArgs() {
    ExitCode code = ServerCli.run(new String[] {"port=0", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: server"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid server arguments")));
  }

  @Test
  void unknownSwitchIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ServerCli.run(new String[] {"--dryrun"}));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Unknown server option(s): [--dryrun]")));
  }

  @Test
  void bareWordIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, ServerCli.run(new String[] {"8080"}));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = ServerCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Configuration file does not exist")));
  }

  @Test
  void malformedConfigFileReturnsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("filedrop.yaml"), "server:\n  port: [1, 2]\n");

    assertEquals(ExitCode.CONFIG_ERROR, ServerCli.run(new String[] {"config=" + yaml, "--dry-run"}));
  }

  @Test
  void cliOverridesYamlWithWarning() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("filedrop.yaml"), """
        server:
          port: 9090
          root: %s
          metricsExporter: none
          dryRun: true
        """.formatted(tempDir.resolve("yaml-root")));

    ExitCode code = ServerCli.run(new String[] {"config=" + yaml, "port=9191"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("listen: *:9191"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: port")));
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, ServerCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("--create-roots"));
  }
}
