package ca.gc.cra.filedrop.infrastructure.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.filedrop.testutil.IdentityFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlIdentityStoreAdapterTest {
  @TempDir Path dir;

  @Test
  void loadsUsersAndGroups() throws IOException {
    YamlIdentityStoreAdapter adapter = YamlIdentityStoreAdapter.load(IdentityFixtures.writeYaml(dir));

    assertEquals(2002, adapter.lookupUser("dist1").orElseThrow().uid());
    assertEquals(List.of("dist1", "both1"), adapter.lookupGroup("Distribution").orElseThrow().members());
    assertTrue(adapter.lookupUser("ghost").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyStore() throws IOException {
    Path file = Files.writeString(dir.resolve("empty.yaml"), "");

    assertTrue(YamlIdentityStoreAdapter.load(file).lookupUser("mfg1").isEmpty());
  }

  @Test
  void rejectsStructuralErrors() throws IOException {
    Path notList = Files.writeString(dir.resolve("a.yaml"), "users: mfg1\n");
    Path noUid = Files.writeString(dir.resolve("b.yaml"), "users:\n  - {name: mfg1, gid: 1}\n");
    Path badMembers = Files.writeString(dir.resolve("c.yaml"),
        "groups:\n  - {name: Manufacturing, gid: 1, members: mfg1}\n");

    assertThrows(IllegalArgumentException.class, () -> YamlIdentityStoreAdapter.load(notList));
    assertThrows(IllegalArgumentException.class, () -> YamlIdentityStoreAdapter.load(noUid));
    assertThrows(IllegalArgumentException.class, () -> YamlIdentityStoreAdapter.load(badMembers));
  }

  @Test
  void missingFileFails() {
    assertThrows(IOException.class, () -> YamlIdentityStoreAdapter.load(dir.resolve("missing.yaml")));
  }
}
