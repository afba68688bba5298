package mirror.email.app.store;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.Credential;
import mirror.email.app.entity.OAuthToken;
import mirror.email.app.repository.CredentialRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CredentialStore} on top of JPA. The compare-and-swap rides on the entity's {@code @Version}
 * column: the UPDATE only matches the expected version, so it holds across nodes.
 * Methods are deliberately not transactional; each repository call commits on its own.
 */
@Slf4j
@Component
public class JpaCredentialStore implements CredentialStore {
    private final CredentialRepository credentialRepository;
    private final Clock clock;

    public JpaCredentialStore(CredentialRepository credentialRepository, Clock clock) {
        this.credentialRepository = credentialRepository;
        this.clock = clock;
    }

    @Override
    public Optional<CredentialSnapshot> get(String principalId) {
        try {
            return credentialRepository.findById(principalId).map(JpaCredentialStore::toSnapshot);
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not load credential for principal " + principalId, e);
        }
    }

    @Override
    public boolean compareAndSwap(String principalId, long expectedVersion, CredentialSnapshot replacement) {
        try {
            Credential credential = credentialRepository.findById(principalId).orElse(null);
            if (credential == null || !Objects.equals(credential.getVersion(), expectedVersion)) {
                return false;
            }
            apply(credential, replacement);
            credentialRepository.saveAndFlush(credential);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.debug("Credential {} moved past version {} during swap", principalId, expectedVersion);
            return false;
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not update credential for principal " + principalId, e);
        }
    }

    @Override
    public CredentialSnapshot saveAuthorization(CredentialSnapshot grant) {
        try {
            Credential credential = credentialRepository.findById(grant.getPrincipalId()).orElseGet(() -> {
                Credential created = new Credential();
                created.setPrincipalId(grant.getPrincipalId());
                return created;
            });
            apply(credential, grant);
            return toSnapshot(credentialRepository.saveAndFlush(credential));
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not store authorization for principal " + grant.getPrincipalId(), e);
        }
    }

    private void apply(Credential credential, CredentialSnapshot snapshot) {
        OAuthToken token = new OAuthToken();
        token.setAccessToken(snapshot.getAccessToken());
        token.setRefreshToken(snapshot.getRefreshToken());
        token.setExpiry(snapshot.getExpiry());
        token.setScopes(snapshot.getScopes());
        credential.setToken(token);
        credential.setStatus(snapshot.getStatus());
        credential.setRefreshStartedAt(snapshot.getRefreshStartedAt());
        credential.setUpdatedAt(clock.instant());
    }

    static CredentialSnapshot toSnapshot(Credential credential) {
        OAuthToken token = credential.getToken() != null ? credential.getToken() : new OAuthToken();
        return CredentialSnapshot.builder()
            .principalId(credential.getPrincipalId())
            .accessToken(token.getAccessToken())
            .refreshToken(token.getRefreshToken())
            .expiry(token.getExpiry())
            .scopes(token.getScopes())
            .status(credential.getStatus())
            .refreshStartedAt(credential.getRefreshStartedAt())
            .version(credential.getVersion() != null ? credential.getVersion() : 0L)
            .updatedAt(credential.getUpdatedAt())
            .build();
    }
}
