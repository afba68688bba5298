package mirror.email.app.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.ProviderError;

import java.time.Instant;

/**
 * Answer to "give me a usable access token": the token, a transient failure, or a demand to re-authorize.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenResult {

    public enum Status {
        OK,
        RETRYABLE,
        NEEDS_REAUTH
    }

    private final Status status;
    private final String accessToken;
    private final Instant expiry;
    private final ProviderError error;
    private final String reason;

    public static TokenResult ok(String accessToken, Instant expiry) {
        return new TokenResult(Status.OK, accessToken, expiry, null, null);
    }

    public static TokenResult retryable(ProviderError error) {
        return new TokenResult(Status.RETRYABLE, null, null, error, error.getMessage());
    }

    public static TokenResult retryable(String reason) {
        return retryable(ProviderError.of(ErrorKind.TRANSIENT_NETWORK, reason));
    }

    public static TokenResult needsReauth(String reason) {
        return new TokenResult(Status.NEEDS_REAUTH, null, null, null, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean needsReauth() {
        return status == Status.NEEDS_REAUTH;
    }

    @Override
    public String toString() {
        return status == Status.OK ? "TokenResult.OK(expiry=" + expiry + ")" : "TokenResult." + status + "(" + reason + ")";
    }
}
