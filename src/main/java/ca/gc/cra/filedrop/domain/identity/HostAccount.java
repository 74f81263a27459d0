package ca.gc.cra.filedrop.domain.identity;

import java.util.Objects;

/**
 * Host account entry as exposed by an identity store.
 *
 * @param username account name
 * @param uid numeric user id
 * @param gid numeric primary group id
 * @since 0.1.0
 */
public record HostAccount(String username, long uid, long gid) {

  /**
   * Validates account fields.
   */
  public HostAccount {
    Objects.requireNonNull(username, "username");
    if (uid < 0 || gid < 0) {
      throw new IllegalArgumentException("uid and gid must be non-negative");
    }
  }
}
