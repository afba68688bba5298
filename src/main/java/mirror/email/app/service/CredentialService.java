package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.entity.User;
import mirror.email.app.repository.UserRepository;
import mirror.email.app.store.CredentialSnapshot;
import mirror.email.app.store.CredentialStore;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Principals and the authorization grants they hand us at login.
 */
@Slf4j
@Service
public class CredentialService {
    private final UserRepository userRepository;
    private final CredentialStore credentialStore;
    private final Clock clock;

    public CredentialService(UserRepository userRepository, CredentialStore credentialStore, Clock clock) {
        this.userRepository = userRepository;
        this.credentialStore = credentialStore;
        this.clock = clock;
    }

    @Transactional
    public User getOrCreateUser(Authentication authentication) {
        OAuth2User oauth2User = (OAuth2User) authentication.getPrincipal();
        String userId = oauth2User.getName(); // Google subject
        String email = oauth2User.getAttribute("email");
        String name = oauth2User.getAttribute("name");

        Optional<User> existingUser = userRepository.findById(userId);
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (email != null && !email.equals(user.getPrimaryEmail())) {
                user.setPrimaryEmail(email);
                return userRepository.save(user);
            }
            return user;
        }
        User user = new User();
        user.setId(userId);
        user.setPrimaryEmail(email);
        user.setDisplayName(name);
        user.setCreatedAt(clock.instant());
        log.info("Created principal {} for {}", userId, email);
        return userRepository.save(user);
    }

    /**
     * Stores a fresh grant from the OAuth callback and reactivates the credential.
     * Google omits the refresh token on repeat consent; the stored one is kept then.
     */
    public CredentialSnapshot storeAuthorizationGrant(User user, String accessToken, String refreshToken,
                                                      Instant expiresAt, String scopes) {
        String effectiveRefreshToken = refreshToken;
        if (effectiveRefreshToken == null || effectiveRefreshToken.isEmpty()) {
            effectiveRefreshToken = credentialStore.get(user.getId())
                .map(CredentialSnapshot::getRefreshToken)
                .orElse(null);
        }
        if (effectiveRefreshToken == null) {
            log.warn("No refresh token granted for principal {}; access ends when the token expires", user.getId());
        }

        CredentialSnapshot stored = credentialStore.saveAuthorization(CredentialSnapshot.builder()
            .principalId(user.getId())
            .accessToken(accessToken)
            .refreshToken(effectiveRefreshToken)
            .expiry(expiresAt)
            .scopes(scopes)
            .status(CredentialStatus.ACTIVE)
            .build());

        user.setLastLoginAt(clock.instant());
        userRepository.save(user);
        return stored;
    }
}
