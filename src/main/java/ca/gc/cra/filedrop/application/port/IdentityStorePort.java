package ca.gc.cra.filedrop.application.port;

import ca.gc.cra.filedrop.domain.identity.HostAccount;
import ca.gc.cra.filedrop.domain.identity.HostGroup;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Read-only view of the host account and group databases.
 * <p><strong>Why:</strong> Decouples authentication from {@code /etc/passwd}-style lookups so tests and
 * development setups can substitute a fixture store.</p>
 * <p><strong>Role:</strong> Input port consumed by
 * {@link ca.gc.cra.filedrop.application.identity.IdentityResolver}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent lookups from session workers;
 * the underlying data is treated as externally managed and already consistent.</p>
 *
 * @since 0.1.0
 */
public interface IdentityStorePort {
  /**
   * Looks up a host account by name.
   *
   * @param username account name exactly as received
   * @return account when present
   * @throws IOException if the backing database cannot be read
   */
  Optional<HostAccount> lookupUser(String username) throws IOException;

  /**
   * Looks up a host group by name.
   *
   * @param groupName group name
   * @return group when present
   * @throws IOException if the backing database cannot be read
   */
  Optional<HostGroup> lookupGroup(String groupName) throws IOException;

  /**
   * Tests membership using two independent checks: the account is listed explicitly in the group, or the
   * group is the account's primary group. A missing group yields {@code false}.
   *
   * @param account resolved host account
   * @param groupName group to test
   * @return {@code true} when either check passes
   * @throws IOException if the group database cannot be read
   */
  default boolean isMemberOfGroup(HostAccount account, String groupName) throws IOException {
    Optional<HostGroup> group = lookupGroup(groupName);
    if (group.isEmpty()) {
      return false;
    }
    HostGroup resolved = group.get();
    return resolved.listsMember(account.username()) || resolved.gid() == account.gid();
  }
}
