package ca.gc.cra.filedrop.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.filedrop.application.port.PayloadSource;
import ca.gc.cra.filedrop.application.session.ProtocolException;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.protocol.StatusCode;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class WireSessionChannelTest {

  @Test
  void readsCoalescedRequestAndBoundsPayload() throws IOException {
    ByteArrayOutputStream wire = new ByteArrayOutputStream();
    WireCodec.writeField(wire, "username", "mfg1", ProtocolLimits.MAX_USERNAME_BYTES);
    WireCodec.writeField(wire, "password", "secret", ProtocolLimits.MAX_PASSWORD_BYTES);
    WireCodec.writeField(wire, "department", "Manufacturing", ProtocolLimits.MAX_DEPARTMENT_BYTES);
    WireCodec.writeField(wire, "filename", "a.txt", ProtocolLimits.MAX_FILENAME_BYTES);
    WireCodec.writeUnsignedInt(wire, 5);
    wire.write("ABCDEtrailing".getBytes(StandardCharsets.US_ASCII));
    ByteArrayOutputStream replies = new ByteArrayOutputStream();

    WireSessionChannel channel =
        new WireSessionChannel(new ByteArrayInputStream(wire.toByteArray()), replies, "127.0.0.1:5000");

    assertEquals("mfg1", channel.readUsername());
    assertEquals("secret", channel.readPassword());
    assertEquals(new TransferRequest("Manufacturing", "a.txt", 5), channel.readTransferRequest());

    PayloadSource payload = channel.payload(5);
    payload.onReady();
    byte[] buffer = new byte[64];
    int total = 0;
    int n;
    while ((n = payload.read(buffer, total, buffer.length - total)) > 0) {
      total += n;
    }
    assertEquals("ABCDE", new String(buffer, 0, total, StandardCharsets.US_ASCII));
    assertEquals(-1, payload.read(buffer, 0, buffer.length));

    Response ready = WireCodec.readResponse(new ByteArrayInputStream(replies.toByteArray())).orElseThrow();
    assertEquals(StatusCode.READY, ready.status());
  }

  @Test
  void oversizedFilenameIsRejected() throws IOException {
    ByteArrayOutputStream wire = new ByteArrayOutputStream();
    WireCodec.writeField(wire, "department", "Manufacturing", ProtocolLimits.MAX_DEPARTMENT_BYTES);
    WireCodec.writeField(wire, "filename", "f".repeat(300), 1_000);
    WireSessionChannel channel =
        new WireSessionChannel(new ByteArrayInputStream(wire.toByteArray()), new ByteArrayOutputStream(), "peer");

    assertThrows(ProtocolException.class, channel::readTransferRequest);
  }
}
