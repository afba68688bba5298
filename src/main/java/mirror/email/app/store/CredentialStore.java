package mirror.email.app.store;

import java.util.Optional;

/**
 * Durable credential records, one per principal.
 */
public interface CredentialStore {
    Optional<CredentialSnapshot> get(String principalId);

    /**
     * Replace the record only if it is still at {@code expectedVersion}.
     * A successful swap leaves the record at {@code expectedVersion + 1}.
     * @return false when the record changed or disappeared in the meantime
     */
    boolean compareAndSwap(String principalId, long expectedVersion, CredentialSnapshot replacement);

    /**
     * Unconditionally store a fresh authorization grant, creating the record if needed.
     */
    CredentialSnapshot saveAuthorization(CredentialSnapshot grant);
}
