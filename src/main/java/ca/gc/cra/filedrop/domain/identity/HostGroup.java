package ca.gc.cra.filedrop.domain.identity;

import java.util.List;
import java.util.Objects;

/**
 * Host group entry as exposed by an identity store.
 *
 * @param name group name
 * @param gid numeric group id
 * @param members account names listed explicitly as members; primary-group members are usually absent
 * @since 0.1.0
 */
public record HostGroup(String name, long gid, List<String> members) {

  /**
   * Validates group fields and freezes the member list.
   */
  public HostGroup {
    Objects.requireNonNull(name, "name");
    members = members == null ? List.of() : List.copyOf(members);
  }

  /**
   * Checks whether the username is listed as an explicit member.
   *
   * @param username account name to test
   * @return {@code true} when listed in the member list
   */
  public boolean listsMember(String username) {
    return members.contains(username);
  }
}
