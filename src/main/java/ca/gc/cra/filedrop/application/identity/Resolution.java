package ca.gc.cra.filedrop.application.identity;

import ca.gc.cra.filedrop.domain.identity.Identity;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of resolving a username against the identity store.
 *
 * @param status resolution status
 * @param identity authenticated identity; present only when {@code status == AUTHENTICATED}
 * @since 0.1.0
 */
public record Resolution(Status status, Optional<Identity> identity) {

  /** Resolution states. */
  public enum Status {
    /** Account exists and belongs to at least one department group. */
    AUTHENTICATED,
    /** No host account with the given name. */
    NOT_FOUND,
    /** Account exists but belongs to neither department group. */
    NOT_AUTHORIZED
  }

  /**
   * Validates that an identity accompanies exactly the authenticated status.
   */
  public Resolution {
    Objects.requireNonNull(status, "status");
    identity = Objects.requireNonNullElse(identity, Optional.empty());
    if ((status == Status.AUTHENTICATED) != identity.isPresent()) {
      throw new IllegalArgumentException("identity must be present only for AUTHENTICATED");
    }
  }

  static Resolution authenticated(Identity identity) {
    return new Resolution(Status.AUTHENTICATED, Optional.of(identity));
  }

  static Resolution notFound() {
    return new Resolution(Status.NOT_FOUND, Optional.empty());
  }

  static Resolution notAuthorized() {
    return new Resolution(Status.NOT_AUTHORIZED, Optional.empty());
  }

  /**
   * Indicates whether the username authenticated.
   *
   * @return {@code true} for {@link Status#AUTHENTICATED}
   */
  public boolean authenticated() {
    return status == Status.AUTHENTICATED;
  }
}
