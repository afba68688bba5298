package mirror.email.app.store;

import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.SyncCursor;

import java.util.Optional;

/**
 * Local mirror of provider messages plus the per-principal sync cursor.
 * Every write is an individual atomic operation.
 */
public interface MailboxStore {
    boolean existsByProviderId(String principalId, String providerMessageId);

    Optional<EmailItem> findByProviderId(String principalId, String providerMessageId);

    Optional<EmailItem> findById(String principalId, String id);

    /**
     * Insert or update the message keyed on (principal, provider message id).
     * Writing the same message twice leaves exactly one row.
     */
    EmailItem upsert(EmailItem item);

    Optional<SyncCursor> getCursor(String principalId);

    /**
     * Store the cursor. A watermark older than the stored one is ignored.
     */
    void setCursor(SyncCursor cursor);
}
