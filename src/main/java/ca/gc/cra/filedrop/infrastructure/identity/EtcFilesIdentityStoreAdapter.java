package ca.gc.cra.filedrop.infrastructure.identity;

import ca.gc.cra.filedrop.application.port.IdentityStorePort;
import ca.gc.cra.filedrop.domain.identity.HostAccount;
import ca.gc.cra.filedrop.domain.identity.HostGroup;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads host accounts and groups from {@code passwd}- and {@code group}-format files.
 * <p><strong>Why:</strong> Account and group membership are managed by the host; every lookup re-reads the
 * files so changes apply to the next connection without a restart.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the configured paths.</p>
 *
 * <p>Formats: {@code name:password:uid:gid:gecos:home:shell} and {@code name:password:gid:member1,member2}.
 * Blank lines and {@code #} comments are skipped; malformed lines are skipped and logged at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class EtcFilesIdentityStoreAdapter implements IdentityStorePort {
  private static final Logger log = LoggerFactory.getLogger(EtcFilesIdentityStoreAdapter.class);

  /** Default account database. */
  public static final Path DEFAULT_PASSWD = Path.of("/etc/passwd");
  /** Default group database. */
  public static final Path DEFAULT_GROUP = Path.of("/etc/group");

  private final Path passwdFile;
  private final Path groupFile;

  /**
   * Creates an adapter over the given files.
   *
   * @param passwdFile account database
   * @param groupFile group database
   */
  public EtcFilesIdentityStoreAdapter(Path passwdFile, Path groupFile) {
    this.passwdFile = Objects.requireNonNull(passwdFile, "passwdFile");
    this.groupFile = Objects.requireNonNull(groupFile, "groupFile");
  }

  @Override
  public Optional<HostAccount> lookupUser(String username) throws IOException {
    for (String[] fields : records(passwdFile, 4)) {
      if (!fields[0].equals(username)) {
        continue;
      }
      try {
        return Optional.of(new HostAccount(fields[0], Long.parseLong(fields[2]), Long.parseLong(fields[3])));
      } catch (IllegalArgumentException ex) {
        log.debug("Skipping malformed passwd entry for '{}' in {}: {}", fields[0], passwdFile, ex.getMessage());
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<HostGroup> lookupGroup(String groupName) throws IOException {
    for (String[] fields : records(groupFile, 3)) {
      if (!fields[0].equals(groupName)) {
        continue;
      }
      try {
        long gid = Long.parseLong(fields[2]);
        return Optional.of(new HostGroup(fields[0], gid, members(fields.length > 3 ? fields[3] : "")));
      } catch (NumberFormatException ex) {
        log.debug("Skipping malformed group entry for '{}' in {}: {}", fields[0], groupFile, ex.getMessage());
      }
    }
    return Optional.empty();
  }

  private static List<String[]> records(Path file, int minFields) throws IOException {
    List<String[]> records = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNo = 0;
      while ((line = reader.readLine()) != null) {
        lineNo++;
        if (line.isBlank() || line.startsWith("#")) {
          continue;
        }
        String[] fields = line.split(":", -1);
        if (fields.length < minFields || fields[0].isEmpty()) {
          log.debug("Skipping malformed line {} in {}", lineNo, file);
          continue;
        }
        records.add(fields);
      }
    }
    return records;
  }

  private static List<String> members(String field) {
    List<String> members = new ArrayList<>();
    for (String member : field.split(",")) {
      String trimmed = member.trim();
      if (!trimmed.isEmpty()) {
        members.add(trimmed);
      }
    }
    return members;
  }
}
