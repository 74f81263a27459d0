package ca.gc.cra.filedrop.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.filedrop.application.identity.IdentityResolver;
import ca.gc.cra.filedrop.application.port.TransferWriterPort;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.protocol.SessionOutcome;
import ca.gc.cra.filedrop.domain.protocol.StatusCode;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentDirectories;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentTransferWriter;
import ca.gc.cra.filedrop.testutil.InMemoryIdentityStore;
import ca.gc.cra.filedrop.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class UploadSessionTest {
  @TempDir Path root;

  private InMemoryIdentityStore store;
  private RecordingMetricsPort metrics;
  private UploadSession session;

  @BeforeEach
  void setUp() {
    store = InMemoryIdentityStore.standard();
    metrics = new RecordingMetricsPort();
    TransferWriterPort writer = new DepartmentTransferWriter(DepartmentDirectories.prepare(root, true), 4);
    session = new UploadSession(new IdentityResolver(store), writer, metrics);
  }

  @Test
  void storesFileAndReportsEachStep() throws IOException {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "hunter2").upload("Manufacturing", "a.txt", "ABCDE");

    assertEquals(SessionOutcome.SUCCESS, session.run(channel));

    assertEquals(List.of(StatusCode.OK, StatusCode.READY, StatusCode.OK), statuses(channel));
    assertEquals(Response.authenticated("Manufacturing"), channel.sent.get(0));
    assertEquals(Response.transferred("a.txt", "Manufacturing"), channel.sent.get(2));
    assertEquals("ABCDE", Files.readString(root.resolve("Manufacturing/a.txt")));
    assertEquals("mfg1", Files.readString(root.resolve("Manufacturing/a.txt.owner")));
    assertEquals(1, metrics.count("session.accepted"));
    assertEquals(1, metrics.count("session.auth.success"));
    assertEquals(1, metrics.count("transfer.completed"));
    assertEquals(List.of(5L), metrics.observed("transfer.bytes"));
    assertEquals(1, metrics.observed("transfer.latencyNanos").size());
  }

  @Test
  void emptyPayloadStoresEmptyFile() throws IOException {
    FakeSessionChannel channel = new FakeSessionChannel("dist1", "pw").upload("Distribution", "empty.bin", "");

    assertEquals(SessionOutcome.SUCCESS, session.run(channel));
    assertEquals(0, Files.size(root.resolve("Distribution/empty.bin")));
  }

  @Test
  void unknownUserIsRejectedBeforeAnyTransferMetadata() {
    FakeSessionChannel channel = new FakeSessionChannel("ghost", "pw").upload("Manufacturing", "a.txt", "ABC");

    assertEquals(SessionOutcome.UNAUTHENTICATED, session.run(channel));

    assertEquals(List.of(Response.userNotFound()), channel.sent);
    assertFalse(channel.requestRead());
    assertEquals(1, metrics.count("session.auth.failure"));
  }

  @Test
  void emptyUsernameIsTreatedAsUnknown() {
    FakeSessionChannel channel = new FakeSessionChannel("", "pw");

    assertEquals(SessionOutcome.UNAUTHENTICATED, session.run(channel));
    assertEquals(List.of(Response.userNotFound()), channel.sent);
  }

  @Test
  void accountOutsideDepartmentGroupsIsRejected() {
    FakeSessionChannel channel = new FakeSessionChannel("outsider", "pw");

    assertEquals(SessionOutcome.UNAUTHENTICATED, session.run(channel));
    assertEquals(List.of(Response.userNotInGroups()), channel.sent);
  }

  @Test
  void identityStoreFailureIsReportedAsAuthenticationFailure() {
    store.failWith(new IOException("passwd unreadable"));
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw");

    assertEquals(SessionOutcome.UNAUTHENTICATED, session.run(channel));
    assertEquals(List.of(Response.identityUnavailable()), channel.sent);
  }

  @Test
  void otherDepartmentIsDeniedAndNothingIsWritten() {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw").upload("Distribution", "a.txt", "ABC");

    assertEquals(SessionOutcome.FORBIDDEN, session.run(channel));

    assertEquals(List.of(StatusCode.OK, StatusCode.ACCESS_DENIED), statuses(channel));
    assertFalse(Files.exists(root.resolve("Distribution/a.txt")));
    assertFalse(Files.exists(root.resolve("Manufacturing/a.txt")));
    assertEquals(1, metrics.count("session.access.denied"));
  }

  @Test
  void departmentComparisonIsCaseSensitive() {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw").upload("manufacturing", "a.txt", "ABC");

    assertEquals(SessionOutcome.FORBIDDEN, session.run(channel));
  }

  @Test
  void directoryComponentsInFilenameAreDiscarded() throws IOException {
    FakeSessionChannel channel =
        new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "../../etc/passwd", "owned");

    assertEquals(SessionOutcome.SUCCESS, session.run(channel));

    assertEquals("owned", Files.readString(root.resolve("Manufacturing/passwd")));
    assertFalse(Files.exists(root.resolve("passwd")));
  }

  @Test
  void filenameWithoutBasenameIsAProtocolError() {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "dir/", "ABC");

    assertEquals(SessionOutcome.PROTOCOL_FAILURE, session.run(channel));
    assertEquals(List.of(StatusCode.OK, StatusCode.PROTOCOL_ERROR), statuses(channel));
  }

  @Test
  void shortPayloadKeepsPartialFileWithoutAttribution() throws IOException {
    FakeSessionChannel channel =
        new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "part.bin", 10, "ABCD");

    assertEquals(SessionOutcome.INCOMPLETE, session.run(channel));

    assertEquals(List.of(StatusCode.OK, StatusCode.READY), statuses(channel));
    assertEquals("ABCD", Files.readString(root.resolve("Manufacturing/part.bin")));
    assertFalse(Files.exists(root.resolve("Manufacturing/part.bin.owner")));
    assertEquals(1, metrics.count("transfer.incomplete"));
  }

  @Test
  void unsendableReadyIsAnIncompleteTransferNotAnIoFailure() throws IOException {
    FakeSessionChannel channel =
        new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "gone.bin", "ABC").failReady();

    assertEquals(SessionOutcome.INCOMPLETE, session.run(channel));

    assertEquals(List.of(StatusCode.OK), statuses(channel));
    assertEquals(0, Files.size(root.resolve("Manufacturing/gone.bin")));
    assertEquals(1, metrics.count("transfer.incomplete"));
    assertEquals(0, metrics.count("transfer.io.failure"));
  }

  @Test
  void malformedCredentialsGetAProtocolErrorFrame() {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw")
        .failCredentials(new ProtocolException("username exceeds 32 bytes (declared 65535)"));

    assertEquals(SessionOutcome.PROTOCOL_FAILURE, session.run(channel));

    assertEquals(1, channel.sent.size());
    assertEquals(StatusCode.PROTOCOL_ERROR, channel.sent.get(0).status());
    assertTrue(channel.sent.get(0).message().contains("username exceeds 32 bytes"));
    assertEquals(1, metrics.count("session.protocol.failure"));
  }

  @Test
  void transportFailureOnTransferRequestSendsNothingFurther() {
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw").failRequest(new IOException("reset"));

    assertEquals(SessionOutcome.PROTOCOL_FAILURE, session.run(channel));
    assertEquals(List.of(StatusCode.OK), statuses(channel));
  }

  @Test
  void unopenableDestinationIsReportedAsIoError() {
    TransferWriterPort failing = (uploader, request, source) -> {
      throw new DestinationUnavailableException("Permission denied", null);
    };
    UploadSession denied = new UploadSession(new IdentityResolver(store), failing, metrics);
    FakeSessionChannel channel = new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "a.txt", "ABC");

    assertEquals(SessionOutcome.IO_FAILURE, denied.run(channel));

    assertEquals(Response.cannotCreate("Permission denied"), channel.sent.get(1));
    assertEquals(1, metrics.count("transfer.io.failure"));
  }

  @Test
  void unsendableAuthenticationResponseEndsSession() {
    FakeSessionChannel channel =
        new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "a.txt", "ABC").failSends();

    assertEquals(SessionOutcome.PROTOCOL_FAILURE, session.run(channel));
    assertFalse(channel.requestRead());
  }

  @Test
  void userMdcIsRestoredAfterSession() {
    MDC.put("user", "outer");
    try {
      session.run(new FakeSessionChannel("mfg1", "pw").upload("Manufacturing", "a.txt", "A"));
      assertEquals("outer", MDC.get("user"));
    } finally {
      MDC.remove("user");
    }
  }

  private static List<StatusCode> statuses(FakeSessionChannel channel) {
    return channel.sent.stream().map(Response::status).toList();
  }
}
