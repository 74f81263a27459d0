package ca.gc.cra.filedrop.infrastructure.identity;

import ca.gc.cra.filedrop.application.port.IdentityStorePort;
import ca.gc.cra.filedrop.domain.identity.HostAccount;
import ca.gc.cra.filedrop.domain.identity.HostGroup;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Identity store backed by a YAML fixture, for development hosts without the department groups.
 *
 * <pre>
 * users:
 *   - { name: mfg1, uid: 1001, gid: 1001 }
 * groups:
 *   - { name: Manufacturing, gid: 2001, members: [mfg1] }
 * </pre>
 *
 * <p>The document is parsed once at construction; lookups are read-only and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class YamlIdentityStoreAdapter implements IdentityStorePort {
  private final Map<String, HostAccount> accounts;
  private final Map<String, HostGroup> groups;

  private YamlIdentityStoreAdapter(Map<String, HostAccount> accounts, Map<String, HostGroup> groups) {
    this.accounts = Map.copyOf(accounts);
    this.groups = Map.copyOf(groups);
  }

  /**
   * Loads a fixture document.
   *
   * @param path YAML file
   * @return adapter over the parsed fixture
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document structure is invalid
   */
  public static YamlIdentityStoreAdapter load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return new YamlIdentityStoreAdapter(Map.of(), Map.of());
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("identity fixture " + path + " must be a mapping");
      }
      Map<String, HostAccount> accounts = new LinkedHashMap<>();
      for (Map<?, ?> entry : entries(root.get("users"), "users")) {
        HostAccount account = new HostAccount(
            text(entry, "name", "users"), number(entry, "uid", "users"), number(entry, "gid", "users"));
        accounts.put(account.username(), account);
      }
      Map<String, HostGroup> groups = new LinkedHashMap<>();
      for (Map<?, ?> entry : entries(root.get("groups"), "groups")) {
        HostGroup group = new HostGroup(
            text(entry, "name", "groups"), number(entry, "gid", "groups"), members(entry.get("members")));
        groups.put(group.name(), group);
      }
      return new YamlIdentityStoreAdapter(accounts, groups);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse identity fixture at " + path, ex);
    }
  }

  @Override
  public Optional<HostAccount> lookupUser(String username) {
    return Optional.ofNullable(accounts.get(username));
  }

  @Override
  public Optional<HostGroup> lookupGroup(String groupName) {
    return Optional.ofNullable(groups.get(groupName));
  }

  private static List<Map<?, ?>> entries(Object node, String section) {
    List<Map<?, ?>> entries = new ArrayList<>();
    if (node == null) {
      return entries;
    }
    if (!(node instanceof List<?> list)) {
      throw new IllegalArgumentException(section + " must be a list");
    }
    for (Object item : list) {
      if (!(item instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException(section + " entries must be mappings");
      }
      entries.add(map);
    }
    return entries;
  }

  private static String text(Map<?, ?> entry, String key, String section) {
    Object value = entry.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException(section + " entry is missing '" + key + "'");
    }
    return value.toString();
  }

  private static long number(Map<?, ?> entry, String key, String section) {
    Object value = entry.get(key);
    if (value instanceof Number n) {
      return n.longValue();
    }
    try {
      return Long.parseLong(String.valueOf(value).trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(section + " entry has non-numeric '" + key + "': " + value, ex);
    }
  }

  private static List<String> members(Object node) {
    List<String> members = new ArrayList<>();
    if (node instanceof List<?> list) {
      for (Object member : list) {
        members.add(String.valueOf(member));
      }
    } else if (node != null) {
      throw new IllegalArgumentException("group members must be a list");
    }
    return members;
  }
}
