package dockhand.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.UserAccount;

/**
 * Port to the user account store owned by the registration service.
 */
public interface UserAccountRepository {

    /**
     * Load the current state of a user account.
     *
     * @param userId the user id from a session token
     * @return Uni with the account, empty if it no longer exists
     */
    Uni<Optional<UserAccount>> findById(String userId);
}
