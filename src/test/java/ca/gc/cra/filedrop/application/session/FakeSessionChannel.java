package ca.gc.cra.filedrop.application.session;

import ca.gc.cra.filedrop.application.port.PayloadSource;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Scripted channel: fields are handed out in protocol order and every frame sent is recorded.
 */
final class FakeSessionChannel implements SessionChannel {
  private final String username;
  private final String password;
  private TransferRequest request;
  private byte[] payload = new byte[0];
  private IOException credentialFailure;
  private IOException requestFailure;
  private boolean failSends;
  private boolean failReady;
  private boolean requestRead;
  final List<Response> sent = new ArrayList<>();

  FakeSessionChannel(String username, String password) {
    this.username = username;
    this.password = password;
  }

  FakeSessionChannel upload(String department, String filename, String content) {
    return upload(department, filename, content.length(), content);
  }

  FakeSessionChannel upload(String department, String filename, long declaredLength, String content) {
    this.request = new TransferRequest(department, filename, declaredLength);
    this.payload = content.getBytes(StandardCharsets.UTF_8);
    return this;
  }

  FakeSessionChannel failCredentials(IOException failure) {
    this.credentialFailure = failure;
    return this;
  }

  FakeSessionChannel failRequest(IOException failure) {
    this.requestFailure = failure;
    return this;
  }

  FakeSessionChannel failSends() {
    this.failSends = true;
    return this;
  }

  FakeSessionChannel failReady() {
    this.failReady = true;
    return this;
  }

  boolean requestRead() {
    return requestRead;
  }

  @Override
  public String peer() {
    return "fake-peer";
  }

  @Override
  public String readUsername() throws IOException {
    if (credentialFailure != null) {
      throw credentialFailure;
    }
    return username;
  }

  @Override
  public String readPassword() {
    return password;
  }

  @Override
  public TransferRequest readTransferRequest() throws IOException {
    requestRead = true;
    if (requestFailure != null) {
      throw requestFailure;
    }
    if (request == null) {
      throw new ProtocolException("connection closed while reading department (0 of 2 bytes)");
    }
    return request;
  }

  @Override
  public void send(Response response) throws IOException {
    if (failSends) {
      throw new IOException("Broken pipe");
    }
    sent.add(response);
  }

  @Override
  public PayloadSource payload(long declaredLength) {
    ByteArrayInputStream in = new ByteArrayInputStream(payload);
    return new PayloadSource() {
      @Override
      public void onReady() throws IOException {
        if (failReady) {
          throw new IOException("Broken pipe");
        }
        send(Response.ready(declaredLength));
      }

      @Override
      public int read(byte[] buffer, int offset, int length) {
        return in.read(buffer, offset, length);
      }
    };
  }
}
