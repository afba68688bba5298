package mirror.email.app.provider;

import lombok.Value;

/**
 * Token endpoint answer to a refresh. {@code refreshToken} is null unless the provider rotated it.
 */
@Value
public class TokenGrant {
    String accessToken;
    String refreshToken;
    long expiresInSeconds;
    String scope;
}
