package ca.gc.cra.filedrop.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes identity fixtures matching {@link InMemoryIdentityStore#standard()}.
 */
public final class IdentityFixtures {
  public static final String YAML = """
      users:
        - {name: mfg1, uid: 2001, gid: 3001}
        - {name: dist1, uid: 2002, gid: 100}
        - {name: both1, uid: 2003, gid: 100}
        - {name: outsider, uid: 2004, gid: 100}
      groups:
        - name: Manufacturing
          gid: 3001
          members: [both1]
        - name: Distribution
          gid: 3002
          members: [dist1, both1]
      """;

  public static final String PASSWD = """
      # test accounts
      root:x:0:0:root:/root:/bin/bash
      mfg1:x:2001:3001:Plant floor:/home/mfg1:/bin/bash
      dist1:x:2002:100::/home/dist1:/bin/sh

      both1:x:2003:100::/home/both1:/bin/sh
      outsider:x:2004:100::/home/outsider:/bin/sh
      broken:x:notanumber:100::/:/bin/false
      """;

  public static final String GROUP = """
      root:x:0:
      users:x:100:
      Manufacturing:x:3001:both1
      Distribution:x:3002:dist1,both1
      """;

  private IdentityFixtures() {}

  public static Path writeYaml(Path dir) throws IOException {
    return Files.writeString(dir.resolve("identities.yaml"), YAML, StandardCharsets.UTF_8);
  }

  public static Path writePasswd(Path dir) throws IOException {
    return Files.writeString(dir.resolve("passwd"), PASSWD, StandardCharsets.UTF_8);
  }

  public static Path writeGroup(Path dir) throws IOException {
    return Files.writeString(dir.resolve("group"), GROUP, StandardCharsets.UTF_8);
  }
}
