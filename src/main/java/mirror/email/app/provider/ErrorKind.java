package mirror.email.app.provider;

/**
 * Failure taxonomy shared by the provider client, the token endpoint client and the services on top of them.
 */
public enum ErrorKind {
    /** I/O failure or provider 5xx; retry with backoff. */
    TRANSIENT_NETWORK(true),
    /** Provider quota hit; back off, honouring the retry-after hint when present. */
    RATE_LIMITED(true),
    /** Access token rejected (401/403) although it was valid a moment ago. */
    TOKEN_REVOKED(false),
    /** Refresh token rejected by the token endpoint; the principal has to authorize again. */
    INVALID_GRANT(false),
    /** Provider answered with something that cannot be understood; only that item is lost. */
    MALFORMED_RESPONSE(false),
    /** Provider refused the request itself (400). */
    MALFORMED_REQUEST(false),
    NOT_FOUND(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
