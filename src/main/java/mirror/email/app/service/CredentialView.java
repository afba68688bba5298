package mirror.email.app.service;

import lombok.Value;
import mirror.email.app.entity.CredentialStatus;

import java.time.Instant;

/**
 * Diagnostic view of a credential. Never carries token values.
 */
@Value
public class CredentialView {
    String principalId;
    CredentialStatus status;
    Instant expiry;
    boolean hasRefreshToken;
    String scopes;
    Instant updatedAt;
}
