package mirror.email.app.store;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import mirror.email.app.entity.CredentialStatus;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable view of a stored credential at one version.
 * Every change goes through a compare-and-swap on {@code version}, so a snapshot is never partially updated.
 */
@Value
@Builder(toBuilder = true)
@ToString(exclude = {"accessToken", "refreshToken"})
public class CredentialSnapshot {
    String principalId;
    String accessToken;
    String refreshToken;
    Instant expiry;
    CredentialStatus status;
    String scopes;
    Instant refreshStartedAt;
    long version;
    Instant updatedAt;

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * ACTIVE, has an access token, and does not expire within {@code skew} of {@code now}.
     */
    public boolean isUsableAt(Instant now, Duration skew) {
        return status == CredentialStatus.ACTIVE
            && accessToken != null
            && expiry != null
            && now.plus(skew).isBefore(expiry);
    }
}
