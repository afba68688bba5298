package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.OAuthTokenClient;
import mirror.email.app.provider.ProviderError;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.provider.TokenGrant;
import mirror.email.app.store.CredentialSnapshot;
import mirror.email.app.store.CredentialStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the credential state machine: hands out access tokens, refreshes them before they expire
 * and demotes a credential to NEEDS_REAUTH once the refresh token is rejected.
 * <p>
 * At most one refresh per principal runs in this process (callers share one future); across
 * processes the credential is claimed by a compare-and-swap to REFRESHING with a lease.
 * No lock is held while the token endpoint is called.
 */
@Slf4j
@Service
public class TokenLifecycleService {
    private final CredentialStore credentialStore;
    private final OAuthTokenClient tokenClient;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Duration refreshLease;
    private final Duration waitTimeout;
    private final Duration pollInterval;

    private final ConcurrentHashMap<String, CompletableFuture<TokenResult>> inFlight = new ConcurrentHashMap<>();

    public TokenLifecycleService(CredentialStore credentialStore, OAuthTokenClient tokenClient,
                                 Clock clock, MirrorProperties properties) {
        this.credentialStore = credentialStore;
        this.tokenClient = tokenClient;
        this.clock = clock;
        MirrorProperties.Token token = properties.getToken();
        this.refreshSkew = token.getRefreshSkew();
        this.refreshLease = token.getRefreshLease();
        this.waitTimeout = token.getWaitTimeout();
        this.pollInterval = token.getPollInterval();
    }

    /**
     * Returns an access token valid for at least the refresh skew, refreshing it when needed.
     * A credential in NEEDS_REAUTH, or no credential at all, is answered without any network call.
     */
    public TokenResult getValidToken(String principalId) {
        Optional<CredentialSnapshot> stored = credentialStore.get(principalId);
        if (stored.isEmpty()) {
            return TokenResult.needsReauth("No credential stored for principal " + principalId);
        }
        CredentialSnapshot credential = stored.get();
        if (credential.getStatus() == CredentialStatus.NEEDS_REAUTH) {
            return TokenResult.needsReauth("Credential for principal " + principalId + " must be re-authorized");
        }
        if (credential.isUsableAt(clock.instant(), refreshSkew)) {
            return TokenResult.ok(credential.getAccessToken(), credential.getExpiry());
        }
        return awaitRefresh(principalId);
    }

    /**
     * Expires the stored access token after the provider rejected it, so the next caller refreshes.
     * Does nothing when the stored token has already changed.
     */
    public void invalidateAccessToken(String principalId, String rejectedToken) {
        CredentialSnapshot credential = credentialStore.get(principalId).orElse(null);
        if (credential == null || credential.getStatus() != CredentialStatus.ACTIVE
            || !Objects.equals(credential.getAccessToken(), rejectedToken)) {
            return;
        }
        CredentialSnapshot expired = credential.toBuilder().expiry(Instant.EPOCH).build();
        if (credentialStore.compareAndSwap(principalId, credential.getVersion(), expired)) {
            log.info("Access token for principal {} was rejected by the provider; forcing a refresh", principalId);
        }
    }

    public Optional<CredentialView> describe(String principalId) {
        return credentialStore.get(principalId).map(credential -> new CredentialView(
            credential.getPrincipalId(),
            credential.getStatus(),
            credential.getExpiry(),
            credential.hasRefreshToken(),
            credential.getScopes(),
            credential.getUpdatedAt()));
    }

    private TokenResult awaitRefresh(String principalId) {
        CompletableFuture<TokenResult> mine = new CompletableFuture<>();
        CompletableFuture<TokenResult> running = inFlight.putIfAbsent(principalId, mine);
        if (running != null) {
            log.debug("Joining refresh already in flight for principal {}", principalId);
            return await(principalId, running);
        }
        try {
            TokenResult result = refreshAsLeader(principalId);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(principalId, mine);
        }
    }

    private TokenResult await(String principalId, CompletableFuture<TokenResult> running) {
        try {
            return running.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return TokenResult.retryable("Timed out waiting for the token refresh of principal " + principalId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TokenResult.retryable("Interrupted while waiting for the token refresh of principal " + principalId);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Token refresh failed for principal " + principalId, e.getCause());
        }
    }

    private TokenResult refreshAsLeader(String principalId) {
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        while (true) {
            CredentialSnapshot current = credentialStore.get(principalId).orElse(null);
            if (current == null) {
                return TokenResult.needsReauth("No credential stored for principal " + principalId);
            }
            if (current.getStatus() == CredentialStatus.NEEDS_REAUTH) {
                return TokenResult.needsReauth("Credential for principal " + principalId + " must be re-authorized");
            }
            Instant now = clock.instant();
            // A refresh that just finished elsewhere is reused
            if (current.isUsableAt(now, refreshSkew)) {
                return TokenResult.ok(current.getAccessToken(), current.getExpiry());
            }
            if (System.nanoTime() - deadline > 0) {
                return TokenResult.retryable("Could not claim the credential of principal " + principalId + " in time");
            }
            if (current.getStatus() == CredentialStatus.REFRESHING && !leaseExpired(current, now)) {
                if (!pause()) {
                    return TokenResult.retryable("Interrupted while waiting for another node to refresh principal " + principalId);
                }
                continue;
            }
            if (!current.hasRefreshToken()) {
                CredentialSnapshot demoted = current.toBuilder()
                    .status(CredentialStatus.NEEDS_REAUTH)
                    .refreshStartedAt(null)
                    .build();
                if (credentialStore.compareAndSwap(principalId, current.getVersion(), demoted)) {
                    log.warn("Access token of principal {} expired and no refresh token is stored; re-authorization required", principalId);
                    return TokenResult.needsReauth("No refresh token stored for principal " + principalId);
                }
                continue;
            }
            CredentialSnapshot claimed = current.toBuilder()
                .status(CredentialStatus.REFRESHING)
                .refreshStartedAt(now)
                .build();
            if (credentialStore.compareAndSwap(principalId, current.getVersion(), claimed)) {
                if (current.getStatus() == CredentialStatus.REFRESHING) {
                    log.info("Taking over stale refresh lease of principal {} started at {}", principalId, current.getRefreshStartedAt());
                }
                return refresh(current, current.getVersion() + 1);
            }
        }
    }

    private TokenResult refresh(CredentialSnapshot previous, long claimedVersion) {
        String principalId = previous.getPrincipalId();
        log.info("Refreshing access token for principal {}", principalId);
        ProviderResult<TokenGrant> result;
        try {
            result = tokenClient.refresh(previous.getRefreshToken());
        } catch (RuntimeException e) {
            credentialStore.compareAndSwap(principalId, claimedVersion, released(previous));
            throw e;
        }

        if (result.isOk()) {
            TokenGrant grant = result.getValue();
            Instant expiry = clock.instant().plusSeconds(grant.getExpiresInSeconds());
            CredentialSnapshot refreshed = previous.toBuilder()
                .accessToken(grant.getAccessToken())
                .refreshToken(grant.getRefreshToken() != null ? grant.getRefreshToken() : previous.getRefreshToken())
                .scopes(grant.getScope() != null ? grant.getScope() : previous.getScopes())
                .expiry(expiry)
                .status(CredentialStatus.ACTIVE)
                .refreshStartedAt(null)
                .build();
            if (!credentialStore.compareAndSwap(principalId, claimedVersion, refreshed)) {
                log.warn("Refresh lease of principal {} was taken over before the new token could be stored", principalId);
            } else {
                log.info("Access token for principal {} refreshed, expires at {}", principalId, expiry);
            }
            return TokenResult.ok(grant.getAccessToken(), expiry);
        }

        ProviderError error = result.getError();
        if (error.getKind() == ErrorKind.INVALID_GRANT) {
            CredentialSnapshot demoted = previous.toBuilder()
                .status(CredentialStatus.NEEDS_REAUTH)
                .refreshStartedAt(null)
                .build();
            credentialStore.compareAndSwap(principalId, claimedVersion, demoted);
            log.warn("Refresh token of principal {} was rejected ({}); re-authorization required", principalId, error.getMessage());
            return TokenResult.needsReauth(error.getMessage());
        }

        credentialStore.compareAndSwap(principalId, claimedVersion, released(previous));
        log.warn("Token refresh for principal {} failed with {}: {}", principalId, error.getKind(), error.getMessage());
        return TokenResult.retryable(error);
    }

    // Back to ACTIVE with the material we started from
    private static CredentialSnapshot released(CredentialSnapshot previous) {
        return previous.toBuilder()
            .status(CredentialStatus.ACTIVE)
            .refreshStartedAt(null)
            .build();
    }

    private boolean leaseExpired(CredentialSnapshot credential, Instant now) {
        Instant startedAt = credential.getRefreshStartedAt();
        return startedAt == null || !now.isBefore(startedAt.plus(refreshLease));
    }

    private boolean pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
