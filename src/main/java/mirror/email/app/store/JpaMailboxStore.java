package mirror.email.app.store;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.SyncCursor;
import mirror.email.app.repository.EmailItemRepository;
import mirror.email.app.repository.SyncCursorRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
public class JpaMailboxStore implements MailboxStore {
    private final EmailItemRepository emailItemRepository;
    private final SyncCursorRepository syncCursorRepository;

    public JpaMailboxStore(EmailItemRepository emailItemRepository, SyncCursorRepository syncCursorRepository) {
        this.emailItemRepository = emailItemRepository;
        this.syncCursorRepository = syncCursorRepository;
    }

    @Override
    public boolean existsByProviderId(String principalId, String providerMessageId) {
        try {
            return emailItemRepository.existsByPrincipalIdAndProviderMessageId(principalId, providerMessageId);
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not look up message " + providerMessageId, e);
        }
    }

    @Override
    public Optional<EmailItem> findByProviderId(String principalId, String providerMessageId) {
        try {
            return emailItemRepository.findByPrincipalIdAndProviderMessageId(principalId, providerMessageId);
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not load message " + providerMessageId, e);
        }
    }

    @Override
    public Optional<EmailItem> findById(String principalId, String id) {
        try {
            return emailItemRepository.findByIdAndPrincipalId(id, principalId);
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not load message " + id, e);
        }
    }

    @Override
    public EmailItem upsert(EmailItem item) {
        try {
            Optional<EmailItem> existing = emailItemRepository
                .findByPrincipalIdAndProviderMessageId(item.getPrincipalId(), item.getProviderMessageId());
            if (existing.isPresent()) {
                return emailItemRepository.save(merge(existing.get(), item));
            }
            try {
                return emailItemRepository.saveAndFlush(item);
            } catch (DataIntegrityViolationException e) {
                // Another writer inserted the same key first
                log.debug("Concurrent insert of message {}, merging into the stored row", item.getProviderMessageId());
                EmailItem winner = emailItemRepository
                    .findByPrincipalIdAndProviderMessageId(item.getPrincipalId(), item.getProviderMessageId())
                    .orElseThrow(() -> e);
                return emailItemRepository.save(merge(winner, item));
            }
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not store message " + item.getProviderMessageId(), e);
        }
    }

    @Override
    public Optional<SyncCursor> getCursor(String principalId) {
        try {
            return syncCursorRepository.findById(principalId);
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not load sync cursor for principal " + principalId, e);
        }
    }

    @Override
    public void setCursor(SyncCursor cursor) {
        try {
            Instant watermark = cursor.getWatermark();
            Optional<SyncCursor> current = syncCursorRepository.findById(cursor.getPrincipalId());
            if (current.isPresent() && current.get().getWatermark() != null
                && (watermark == null || watermark.isBefore(current.get().getWatermark()))) {
                watermark = current.get().getWatermark();
            }
            syncCursorRepository.save(new SyncCursor(cursor.getPrincipalId(), cursor.getLastMessageId(), watermark, cursor.getUpdatedAt()));
        } catch (DataAccessException e) {
            throw new RepositoryUnavailableException("Could not store sync cursor for principal " + cursor.getPrincipalId(), e);
        }
    }

    /**
     * Copies provider content and flags onto the stored row. The local id and ingestion time stay;
     * AI fields are only overwritten when the incoming copy has them.
     */
    private static EmailItem merge(EmailItem target, EmailItem incoming) {
        target.setThreadId(incoming.getThreadId());
        target.setSubject(incoming.getSubject());
        target.setSender(incoming.getSender());
        target.setRecipient(incoming.getRecipient());
        target.setSnippet(incoming.getSnippet());
        target.setBody(incoming.getBody());
        target.setReceivedAt(incoming.getReceivedAt());
        target.setRead(incoming.isRead());
        target.setStarred(incoming.isStarred());
        target.setFolder(incoming.getFolder());
        target.setSnoozedUntil(incoming.getSnoozedUntil());
        target.setLabels(incoming.getLabels());
        target.setDirection(incoming.getDirection());
        if (incoming.getCategory() != null) {
            target.setCategory(incoming.getCategory());
            target.setSummary(incoming.getSummary());
            target.setSentiment(incoming.getSentiment());
            target.setImportance(incoming.getImportance());
        }
        if (target.getIngestedAt() == null) {
            target.setIngestedAt(incoming.getIngestedAt());
        }
        return target;
    }
}
