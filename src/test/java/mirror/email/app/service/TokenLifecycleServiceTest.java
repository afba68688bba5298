package mirror.email.app.service;

import mirror.email.app.config.MirrorProperties;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.OAuthTokenClient;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.provider.TokenGrant;
import mirror.email.app.store.CredentialSnapshot;
import mirror.email.app.store.InMemoryCredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenLifecycleServiceTest {
    private static final String PRINCIPAL = "user123";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private OAuthTokenClient tokenClient;

    private InMemoryCredentialStore credentialStore;
    private MirrorProperties properties;
    private TokenLifecycleService tokenLifecycleService;

    @BeforeEach
    void setUp() {
        credentialStore = new InMemoryCredentialStore();
        properties = new MirrorProperties();
        properties.getToken().setPollInterval(Duration.ofMillis(10));
        tokenLifecycleService = new TokenLifecycleService(credentialStore, tokenClient,
            Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    private CredentialSnapshot.CredentialSnapshotBuilder credential() {
        return CredentialSnapshot.builder()
            .principalId(PRINCIPAL)
            .accessToken("old_access_token")
            .refreshToken("refresh_token_123")
            .expiry(NOW.minusSeconds(60))
            .status(CredentialStatus.ACTIVE)
            .scopes("openid email")
            .version(3);
    }

    @Test
    void getValidToken_WithNoCredential_ShouldNeedReauthWithoutNetwork() {
        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertEquals(TokenResult.Status.NEEDS_REAUTH, result.getStatus());
        verifyNoInteractions(tokenClient);
    }

    @Test
    void getValidToken_WithFreshToken_ShouldReturnCachedToken() {
        // Given
        credentialStore.put(credential().expiry(NOW.plusSeconds(3600)).build());

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.isOk());
        assertEquals("old_access_token", result.getAccessToken());
        verifyNoInteractions(tokenClient);
        assertEquals(0, credentialStore.getSwaps());
    }

    @Test
    void getValidToken_WithTokenInsideSkew_ShouldRefresh() {
        // Given
        credentialStore.put(credential().expiry(NOW.plusSeconds(120)).build());
        when(tokenClient.refresh("refresh_token_123"))
            .thenReturn(ProviderResult.ok(new TokenGrant("new_access_token", null, 3600, null)));

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.isOk());
        assertEquals("new_access_token", result.getAccessToken());
    }

    @Test
    void getValidToken_WithExpiredToken_ShouldRefreshAndStoreRotatedRefreshToken() {
        // Given
        credentialStore.put(credential().build());
        when(tokenClient.refresh("refresh_token_123"))
            .thenReturn(ProviderResult.ok(new TokenGrant("new_access_token", "rotated_refresh", 3600, null)));

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.isOk());
        assertEquals("new_access_token", result.getAccessToken());
        assertEquals(NOW.plusSeconds(3600), result.getExpiry());

        CredentialSnapshot stored = credentialStore.get(PRINCIPAL).orElseThrow();
        assertEquals(CredentialStatus.ACTIVE, stored.getStatus());
        assertEquals("new_access_token", stored.getAccessToken());
        assertEquals("rotated_refresh", stored.getRefreshToken());
        assertEquals("openid email", stored.getScopes());
        assertNull(stored.getRefreshStartedAt());
        // claim + store
        assertEquals(5, stored.getVersion());
    }

    @Test
    void getValidToken_WithNeedsReauthCredential_ShouldNotCallTokenEndpoint() {
        // Given
        credentialStore.put(credential().status(CredentialStatus.NEEDS_REAUTH).build());

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.needsReauth());
        verifyNoInteractions(tokenClient);
    }

    @Test
    void getValidToken_WithInvalidGrant_ShouldDemoteAndNeverRefreshAgain() {
        // Given
        credentialStore.put(credential().build());
        when(tokenClient.refresh(anyString()))
            .thenReturn(ProviderResult.failure(ErrorKind.INVALID_GRANT, "Token endpoint answered 400 (invalid_grant)"));

        // When
        TokenResult first = tokenLifecycleService.getValidToken(PRINCIPAL);
        TokenResult second = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(first.needsReauth());
        assertTrue(second.needsReauth());
        assertEquals(CredentialStatus.NEEDS_REAUTH, credentialStore.get(PRINCIPAL).orElseThrow().getStatus());
        verify(tokenClient, times(1)).refresh(anyString());
    }

    @Test
    void getValidToken_WithTransientFailure_ShouldKeepCredentialActive() {
        // Given
        credentialStore.put(credential().build());
        when(tokenClient.refresh(anyString()))
            .thenReturn(ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, "Token endpoint unreachable"));

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertEquals(TokenResult.Status.RETRYABLE, result.getStatus());
        assertEquals(ErrorKind.TRANSIENT_NETWORK, result.getError().getKind());
        CredentialSnapshot stored = credentialStore.get(PRINCIPAL).orElseThrow();
        assertEquals(CredentialStatus.ACTIVE, stored.getStatus());
        assertEquals("old_access_token", stored.getAccessToken());
        assertEquals("refresh_token_123", stored.getRefreshToken());
        assertNull(stored.getRefreshStartedAt());
    }

    @Test
    void getValidToken_WithoutRefreshToken_ShouldDemoteWithoutNetwork() {
        // Given
        credentialStore.put(credential().refreshToken(null).build());

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.needsReauth());
        assertEquals(CredentialStatus.NEEDS_REAUTH, credentialStore.get(PRINCIPAL).orElseThrow().getStatus());
        verifyNoInteractions(tokenClient);
    }

    @Test
    void getValidToken_WhenTokenClientThrows_ShouldReleaseClaim() {
        // Given
        credentialStore.put(credential().build());
        when(tokenClient.refresh(anyString())).thenThrow(new IllegalStateException("client-id is not configured"));

        // When & Then
        assertThrows(IllegalStateException.class, () -> tokenLifecycleService.getValidToken(PRINCIPAL));
        assertEquals(CredentialStatus.ACTIVE, credentialStore.get(PRINCIPAL).orElseThrow().getStatus());
    }

    @Test
    void getValidToken_WithConcurrentCallers_ShouldRefreshExactlyOnce() throws Exception {
        // Given
        credentialStore.put(credential().build());
        AtomicInteger refreshCalls = new AtomicInteger();
        when(tokenClient.refresh(anyString())).thenAnswer(invocation -> {
            refreshCalls.incrementAndGet();
            Thread.sleep(200);
            return ProviderResult.ok(new TokenGrant("new_access_token", null, 3600, null));
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TokenResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return tokenLifecycleService.getValidToken(PRINCIPAL);
                }));
            }

            // When
            start.countDown();

            // Then
            for (Future<TokenResult> future : results) {
                TokenResult result = future.get(10, TimeUnit.SECONDS);
                assertTrue(result.isOk());
                assertEquals("new_access_token", result.getAccessToken());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, refreshCalls.get());
        assertEquals("new_access_token", credentialStore.get(PRINCIPAL).orElseThrow().getAccessToken());
    }

    @Test
    void getValidToken_WithConcurrentCallersAndRevokedGrant_ShouldAllNeedReauth() throws Exception {
        // Given
        credentialStore.put(credential().build());
        when(tokenClient.refresh(anyString())).thenAnswer(invocation -> {
            Thread.sleep(200);
            return ProviderResult.failure(ErrorKind.INVALID_GRANT, "Token endpoint answered 400 (invalid_grant)");
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TokenResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return tokenLifecycleService.getValidToken(PRINCIPAL);
                }));
            }

            // When
            start.countDown();

            // Then
            for (Future<TokenResult> future : results) {
                TokenResult result = future.get(10, TimeUnit.SECONDS);
                assertEquals(TokenResult.Status.NEEDS_REAUTH, result.getStatus());
                assertNull(result.getAccessToken());
            }
        } finally {
            pool.shutdownNow();
        }
        verify(tokenClient, times(1)).refresh(anyString());
        assertEquals(CredentialStatus.NEEDS_REAUTH, credentialStore.get(PRINCIPAL).orElseThrow().getStatus());

        // a later caller sees the demotion without another network call
        assertEquals(TokenResult.Status.NEEDS_REAUTH, tokenLifecycleService.getValidToken(PRINCIPAL).getStatus());
        verify(tokenClient, times(1)).refresh(anyString());
    }

    @Test
    void getValidToken_WhileAnotherNodeHoldsLease_ShouldWaitForItsResult() throws Exception {
        // Given
        credentialStore.put(credential().status(CredentialStatus.REFRESHING).refreshStartedAt(NOW).version(7).build());
        Thread otherNode = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            CredentialSnapshot current = credentialStore.get(PRINCIPAL).orElseThrow();
            credentialStore.compareAndSwap(PRINCIPAL, 7, current.toBuilder()
                .accessToken("token_from_other_node")
                .expiry(NOW.plusSeconds(3600))
                .status(CredentialStatus.ACTIVE)
                .refreshStartedAt(null)
                .build());
        });
        otherNode.start();

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);
        otherNode.join();

        // Then
        assertTrue(result.isOk());
        assertEquals("token_from_other_node", result.getAccessToken());
        verifyNoInteractions(tokenClient);
    }

    @Test
    void getValidToken_WhenForeignLeaseNeverSettles_ShouldBeRetryable() {
        // Given
        properties.getToken().setWaitTimeout(Duration.ofMillis(150));
        tokenLifecycleService = new TokenLifecycleService(credentialStore, tokenClient,
            Clock.fixed(NOW, ZoneOffset.UTC), properties);
        credentialStore.put(credential().status(CredentialStatus.REFRESHING).refreshStartedAt(NOW.minusSeconds(5)).build());

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertEquals(TokenResult.Status.RETRYABLE, result.getStatus());
        verifyNoInteractions(tokenClient);
    }

    @Test
    void getValidToken_WithStaleLease_ShouldTakeOverAndRefresh() {
        // Given
        credentialStore.put(credential().status(CredentialStatus.REFRESHING).refreshStartedAt(NOW.minusSeconds(120)).build());
        when(tokenClient.refresh("refresh_token_123"))
            .thenReturn(ProviderResult.ok(new TokenGrant("new_access_token", null, 3600, null)));

        // When
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertTrue(result.isOk());
        assertEquals(CredentialStatus.ACTIVE, credentialStore.get(PRINCIPAL).orElseThrow().getStatus());
    }

    @Test
    void invalidateAccessToken_WithCurrentToken_ShouldForceRefreshOnNextCall() {
        // Given
        credentialStore.put(credential().expiry(NOW.plusSeconds(3600)).build());
        when(tokenClient.refresh("refresh_token_123"))
            .thenReturn(ProviderResult.ok(new TokenGrant("new_access_token", null, 3600, null)));

        // When
        tokenLifecycleService.invalidateAccessToken(PRINCIPAL, "old_access_token");
        TokenResult result = tokenLifecycleService.getValidToken(PRINCIPAL);

        // Then
        assertEquals("new_access_token", result.getAccessToken());
    }

    @Test
    void invalidateAccessToken_WithAlreadyReplacedToken_ShouldDoNothing() {
        // Given
        credentialStore.put(credential().expiry(NOW.plusSeconds(3600)).build());

        // When
        tokenLifecycleService.invalidateAccessToken(PRINCIPAL, "some_older_token");

        // Then
        assertEquals(NOW.plusSeconds(3600), credentialStore.get(PRINCIPAL).orElseThrow().getExpiry());
        assertEquals(0, credentialStore.getSwaps());
    }

    @Test
    void describe_ShouldNotExposeTokenValues() {
        // Given
        credentialStore.put(credential().build());

        // When
        CredentialView view = tokenLifecycleService.describe(PRINCIPAL).orElseThrow();

        // Then
        assertEquals(CredentialStatus.ACTIVE, view.getStatus());
        assertTrue(view.isHasRefreshToken());
        assertFalse(view.toString().contains("refresh_token_123"));
        assertFalse(view.toString().contains("old_access_token"));
    }
}
