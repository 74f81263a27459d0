package ca.gc.cra.filedrop.infrastructure.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.filedrop.domain.identity.HostAccount;
import ca.gc.cra.filedrop.domain.identity.HostGroup;
import ca.gc.cra.filedrop.testutil.IdentityFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EtcFilesIdentityStoreAdapterTest {
  @TempDir Path dir;

  private EtcFilesIdentityStoreAdapter adapter;

  @BeforeEach
  void setUp() throws IOException {
    adapter = new EtcFilesIdentityStoreAdapter(IdentityFixtures.writePasswd(dir), IdentityFixtures.writeGroup(dir));
  }

  @Test
  void looksUpAccountsByExactName() throws IOException {
    assertEquals(new HostAccount("mfg1", 2001, 3001), adapter.lookupUser("mfg1").orElseThrow());
    assertTrue(adapter.lookupUser("MFG1").isEmpty());
    assertTrue(adapter.lookupUser("ghost").isEmpty());
  }

  @Test
  void skipsCommentsBlankLinesAndMalformedEntries() throws IOException {
    assertTrue(adapter.lookupUser("# test accounts").isEmpty());
    assertTrue(adapter.lookupUser("broken").isEmpty());
    assertEquals(2003, adapter.lookupUser("both1").orElseThrow().uid());
  }

  @Test
  void parsesGroupMembers() throws IOException {
    HostGroup distribution = adapter.lookupGroup("Distribution").orElseThrow();

    assertEquals(3002, distribution.gid());
    assertEquals(List.of("dist1", "both1"), distribution.members());
    assertTrue(adapter.lookupGroup("Manufacturing").orElseThrow().listsMember("both1"));
    assertEquals(List.of(), adapter.lookupGroup("users").orElseThrow().members());
  }

  @Test
  void membershipIncludesPrimaryGroup() throws IOException {
    HostAccount mfg1 = adapter.lookupUser("mfg1").orElseThrow();

    assertTrue(adapter.isMemberOfGroup(mfg1, "Manufacturing"));
    assertFalse(adapter.isMemberOfGroup(mfg1, "Distribution"));
    assertFalse(adapter.isMemberOfGroup(mfg1, "NoSuchGroup"));
  }

  @Test
  void rereadsFilesOnEveryLookup() throws IOException {
    Files.writeString(dir.resolve("passwd"), "late:x:2100:100::/:/bin/sh\n");

    assertTrue(adapter.lookupUser("late").isPresent());
    assertTrue(adapter.lookupUser("mfg1").isEmpty());
  }

  @Test
  void missingDatabaseFails() {
    EtcFilesIdentityStoreAdapter missing =
        new EtcFilesIdentityStoreAdapter(dir.resolve("nope"), dir.resolve("nope-group"));

    assertThrows(IOException.class, () -> missing.lookupUser("mfg1"));
  }
}
