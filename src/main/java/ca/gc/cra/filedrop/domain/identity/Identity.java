package ca.gc.cra.filedrop.domain.identity;

import java.util.Objects;

/**
 * Authenticated uploader pinned to a single department for the lifetime of one session.
 *
 * <p>Created once after the identity resolver succeeds and owned exclusively by that session.</p>
 *
 * @param username host account name
 * @param uid numeric user id of the host account
 * @param gid numeric primary group id of the host account
 * @param department department the account is authorized to write into
 * @since 0.1.0
 */
public record Identity(String username, long uid, long gid, Department department) {

  /**
   * Validates identity components.
   */
  public Identity {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(department, "department");
    if (username.isEmpty()) {
      throw new IllegalArgumentException("username must not be empty");
    }
  }

  /**
   * Checks whether a declared department name grants access, using an exact byte-level comparison.
   *
   * @param declaredDepartment department name as received from the client
   * @return {@code true} when the declared name is exactly this identity's department name
   */
  public boolean mayWriteTo(String declaredDepartment) {
    return Department.fromWireName(declaredDepartment).filter(department::equals).isPresent();
  }
}
