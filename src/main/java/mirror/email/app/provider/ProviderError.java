package mirror.email.app.provider;

import lombok.Value;

import java.time.Duration;

@Value
public class ProviderError {
    ErrorKind kind;
    String message;
    /** Back-off hint from the provider, null when none was sent. */
    Duration retryAfter;

    public static ProviderError of(ErrorKind kind, String message) {
        return new ProviderError(kind, message, null);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
