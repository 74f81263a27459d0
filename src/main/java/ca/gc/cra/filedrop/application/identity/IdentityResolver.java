package ca.gc.cra.filedrop.application.identity;

import ca.gc.cra.filedrop.application.port.IdentityStorePort;
import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.domain.identity.HostAccount;
import ca.gc.cra.filedrop.domain.identity.Identity;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Authenticates a username and pins it to a single department.
 * <p><strong>Why:</strong> Upload authorization is derived purely from host-account existence and membership in
 * the {@code Manufacturing} or {@code Distribution} groups.</p>
 * <p><strong>Role:</strong> Application service invoked once per session after the credentials arrive.</p>
 * <p><strong>Thread-safety:</strong> Stateless beyond the injected store; safe for concurrent sessions.</p>
 *
 * <p>An account in both groups is assigned {@link Department#MANUFACTURING}.</p>
 *
 * @since 0.1.0
 */
public final class IdentityResolver {
  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final IdentityStorePort store;

  /**
   * Creates a resolver over the supplied identity store.
   *
   * @param store host account and group lookups; must not be {@code null}
   */
  public IdentityResolver(IdentityStorePort store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Resolves a username into an identity.
   *
   * @param username account name exactly as received; {@code null} or empty resolves to not-found
   * @return resolution outcome
   * @throws IOException if the identity store cannot be read
   */
  public Resolution resolve(String username) throws IOException {
    if (username == null || username.isEmpty()) {
      return Resolution.notFound();
    }
    Optional<HostAccount> maybeAccount = store.lookupUser(username);
    if (maybeAccount.isEmpty()) {
      log.debug("Account '{}' not present in identity store", username);
      return Resolution.notFound();
    }
    HostAccount account = maybeAccount.get();
    boolean manufacturing = store.isMemberOfGroup(account, Department.MANUFACTURING.displayName());
    boolean distribution = store.isMemberOfGroup(account, Department.DISTRIBUTION.displayName());
    log.debug(
        "Membership for '{}' (uid={}, gid={}): Manufacturing={}, Distribution={}",
        username,
        account.uid(),
        account.gid(),
        manufacturing,
        distribution);

    Department department;
    if (manufacturing) {
      department = Department.MANUFACTURING;
      if (distribution) {
        log.debug("Account '{}' is in both department groups; using Manufacturing", username);
      }
    } else if (distribution) {
      department = Department.DISTRIBUTION;
    } else {
      return Resolution.notAuthorized();
    }
    return Resolution.authenticated(
        new Identity(account.username(), account.uid(), account.gid(), department));
  }
}
