package mirror.email.app.service;

import lombok.Value;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.ProviderError;

/**
 * A failure recorded during a sync run. {@code providerMessageId} is null for run-level failures.
 */
@Value
public class SyncError {
    String providerMessageId;
    ErrorKind kind;
    String message;

    static SyncError of(String providerMessageId, ProviderError error) {
        return new SyncError(providerMessageId, error.getKind(), error.getMessage());
    }
}
