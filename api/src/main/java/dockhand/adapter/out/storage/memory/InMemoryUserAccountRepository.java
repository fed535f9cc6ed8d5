package dockhand.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.AccountStatus;
import dockhand.core.model.auth.UserAccount;
import dockhand.core.model.auth.UserRole;
import dockhand.core.port.out.UserAccountRepository;

/**
 * In-memory user directory.
 *
 * <p>Accounts are owned by the user-management side of the platform; this
 * store only answers lookups and is populated by that side (or by tests).
 */
@ApplicationScoped
public class InMemoryUserAccountRepository implements UserAccountRepository {

    private final ConcurrentHashMap<String, UserAccount> accounts = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<UserAccount>> findById(String userId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(accounts.get(userId)));
    }

    public void put(UserAccount account) {
        accounts.put(account.id(), account);
    }

    /**
     * Store an account whose role is given by its stored name, legacy names included.
     */
    public void put(String userId, String email, String roleName, AccountStatus status) {
        put(new UserAccount(userId, email, UserRole.fromValue(roleName), status));
    }

    public void remove(String userId) {
        accounts.remove(userId);
    }
}
