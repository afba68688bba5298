package mirror.email.app.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.provider.ProviderError;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SendResult {

    public enum Status {
        SENT,
        RETRYABLE,
        FATAL,
        NEEDS_REAUTH
    }

    private final Status status;
    /** The stored outbound copy, only on SENT. */
    private final EmailItem item;
    private final ProviderError error;
    private final String reason;

    static SendResult sent(EmailItem item) {
        return new SendResult(Status.SENT, item, null, null);
    }

    static SendResult failed(ProviderError error) {
        return new SendResult(error.isRetryable() ? Status.RETRYABLE : Status.FATAL, null, error, error.getMessage());
    }

    static SendResult needsReauth(String reason) {
        return new SendResult(Status.NEEDS_REAUTH, null, null, reason);
    }

    public boolean isSent() {
        return status == Status.SENT;
    }
}
