package mirror.email.app.store;

import mirror.email.app.config.ClockConfig;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.repository.CredentialRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JpaCredentialStore.class, ClockConfig.class})
class JpaCredentialStoreTest {
    private static final Instant EXPIRY = Instant.parse("2030-01-01T00:00:00Z");

    @Autowired
    private JpaCredentialStore credentialStore;

    @Autowired
    private CredentialRepository credentialRepository;

    private CredentialSnapshot grant(String accessToken) {
        return CredentialSnapshot.builder()
            .principalId("user123")
            .accessToken(accessToken)
            .refreshToken("refresh_token_123")
            .expiry(EXPIRY)
            .scopes("openid email")
            .status(CredentialStatus.ACTIVE)
            .build();
    }

    @Test
    void saveAuthorization_ForNewPrincipal_ShouldCreateCredential() {
        // When
        CredentialSnapshot stored = credentialStore.saveAuthorization(grant("access_1"));

        // Then
        CredentialSnapshot loaded = credentialStore.get("user123").orElseThrow();
        assertEquals("access_1", loaded.getAccessToken());
        assertEquals("refresh_token_123", loaded.getRefreshToken());
        assertEquals(CredentialStatus.ACTIVE, loaded.getStatus());
        assertEquals(stored.getVersion(), loaded.getVersion());
        assertNotNull(loaded.getUpdatedAt());
    }

    @Test
    void compareAndSwap_WithCurrentVersion_ShouldApplyAndBumpVersion() {
        // Given
        CredentialSnapshot stored = credentialStore.saveAuthorization(grant("access_1"));

        // When
        boolean swapped = credentialStore.compareAndSwap("user123", stored.getVersion(),
            stored.toBuilder().status(CredentialStatus.REFRESHING).refreshStartedAt(Instant.now()).build());

        // Then
        assertTrue(swapped);
        CredentialSnapshot loaded = credentialStore.get("user123").orElseThrow();
        assertEquals(CredentialStatus.REFRESHING, loaded.getStatus());
        assertEquals(stored.getVersion() + 1, loaded.getVersion());
        assertNotNull(loaded.getRefreshStartedAt());
    }

    @Test
    void compareAndSwap_WithStaleVersion_ShouldChangeNothing() {
        // Given
        CredentialSnapshot stored = credentialStore.saveAuthorization(grant("access_1"));
        assertTrue(credentialStore.compareAndSwap("user123", stored.getVersion(), stored.toBuilder().accessToken("access_2").build()));

        // When
        boolean swapped = credentialStore.compareAndSwap("user123", stored.getVersion(),
            stored.toBuilder().accessToken("access_stale").build());

        // Then
        assertFalse(swapped);
        assertEquals("access_2", credentialStore.get("user123").orElseThrow().getAccessToken());
    }

    @Test
    void compareAndSwap_WithUnknownPrincipal_ShouldReturnFalse() {
        assertFalse(credentialStore.compareAndSwap("nobody", 0, grant("access_1")));
        assertTrue(credentialStore.get("nobody").isEmpty());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void compareAndSwap_WithRacingWritersOnSameVersion_ShouldLetExactlyOneWin() throws Exception {
        // Given: every call commits on its own, as it does in production
        String principalId = "racing_user";
        CredentialSnapshot initial = credentialStore.saveAuthorization(grant("access_0").toBuilder().principalId(principalId).build());
        int rounds = 20;
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            for (int round = 1; round <= rounds; round++) {
                CredentialSnapshot current = credentialStore.get(principalId).orElseThrow();
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> attempts = new ArrayList<>();
                for (int writer = 0; writer < writers; writer++) {
                    String accessToken = "access_" + round + "_" + writer;
                    attempts.add(pool.submit(() -> {
                        start.await();
                        return credentialStore.compareAndSwap(principalId, current.getVersion(),
                            current.toBuilder().accessToken(accessToken).build());
                    }));
                }

                // When
                start.countDown();

                // Then
                int winners = 0;
                for (Future<Boolean> attempt : attempts) {
                    if (attempt.get(10, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners, "round " + round);
                assertEquals(current.getVersion() + 1, credentialStore.get(principalId).orElseThrow().getVersion());
            }

            assertEquals(initial.getVersion() + rounds, credentialStore.get(principalId).orElseThrow().getVersion());
        } finally {
            pool.shutdownNow();
            credentialRepository.deleteById(principalId);
        }
    }
}
