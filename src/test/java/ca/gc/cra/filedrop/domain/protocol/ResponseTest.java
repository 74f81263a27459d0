package ca.gc.cra.filedrop.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ResponseTest {

  @Test
  void messagesKeepTheSuccessMarkers() {
    Response auth = Response.authenticated("Manufacturing");
    Response done = Response.transferred("report.txt", "Manufacturing");

    assertEquals("Authentication successful. Department: Manufacturing", auth.message());
    assertEquals("File 'report.txt' successfully transferred to Manufacturing department", done.message());
    assertTrue(auth.isSuccess());
    assertTrue(Response.ready(5).isSuccess());
  }

  @Test
  void failuresCarryTheirStatusCodes() {
    assertEquals(StatusCode.AUTH_FAILED, Response.userNotFound().status());
    assertEquals(StatusCode.ACCESS_DENIED, Response.accessDenied("Distribution").status());
    assertEquals("Error: You don't have access to the Distribution department",
        Response.accessDenied("Distribution").message());
    assertEquals(StatusCode.IO_ERROR, Response.cannotCreate("Permission denied").status());
    assertFalse(Response.invalidFilename().isSuccess());
  }

  @Test
  void statusCodesRoundTripThroughWireValues() {
    for (StatusCode code : StatusCode.values()) {
      assertEquals(code, StatusCode.fromWire(code.wireValue()));
    }
    assertThrows(IllegalArgumentException.class, () -> StatusCode.fromWire(9));
  }
}
