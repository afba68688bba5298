package mirror.email.app.service;

import lombok.Value;
import mirror.email.app.entity.EmailItem;

/**
 * Outcome of a flag change. LOCAL_ONLY means the mirror was updated but the provider was not.
 */
@Value
public class FlagResult {

    public enum Status {
        APPLIED,
        LOCAL_ONLY,
        NOT_FOUND
    }

    Status status;
    EmailItem item;
    boolean reauthRequired;
    String reason;

    static FlagResult applied(EmailItem item) {
        return new FlagResult(Status.APPLIED, item, false, null);
    }

    static FlagResult localOnly(EmailItem item, boolean reauthRequired, String reason) {
        return new FlagResult(Status.LOCAL_ONLY, item, reauthRequired, reason);
    }

    static FlagResult notFound() {
        return new FlagResult(Status.NOT_FOUND, null, false, "Email not found");
    }
}
