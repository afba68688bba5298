package mirror.email.app.provider;

/**
 * The provider's OAuth token endpoint.
 */
public interface OAuthTokenClient {
    /**
     * Exchange a refresh token for a new access token.
     * A FATAL result with kind {@link ErrorKind#INVALID_GRANT} means the refresh token is no longer usable.
     * @param refreshToken the stored refresh token
     * @return the new grant
     */
    ProviderResult<TokenGrant> refresh(String refreshToken);
}
