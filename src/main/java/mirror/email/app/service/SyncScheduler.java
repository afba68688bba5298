package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import mirror.email.app.entity.Credential;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.repository.CredentialRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Periodic background sync of every principal whose credential is still usable.
 */
@Slf4j
@Component
public class SyncScheduler {
    private final CredentialRepository credentialRepository;
    private final MailboxSyncService mailboxSyncService;
    private final SyncLockService syncLockService;
    private final Executor mailSyncExecutor;
    private final int maxMessages;

    public SyncScheduler(CredentialRepository credentialRepository,
                         MailboxSyncService mailboxSyncService,
                         SyncLockService syncLockService,
                         @Qualifier("mailSyncExecutor") Executor mailSyncExecutor,
                         MirrorProperties properties) {
        this.credentialRepository = credentialRepository;
        this.mailboxSyncService = mailboxSyncService;
        this.syncLockService = syncLockService;
        this.mailSyncExecutor = mailSyncExecutor;
        this.maxMessages = properties.getSync().getDefaultMaxMessages();
    }

    @Scheduled(fixedRateString = "${mirror.sync.interval-ms:300000}", initialDelayString = "${mirror.sync.initial-delay-ms:60000}")
    public void syncAll() {
        log.info("Scheduled mailbox sync started");
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Credential credential : credentialRepository.findByStatusNot(CredentialStatus.NEEDS_REAUTH)) {
            String principalId = credential.getPrincipalId();
            futures.add(CompletableFuture.runAsync(() -> syncLocked(principalId), mailSyncExecutor)
                .exceptionally(ex -> {
                    log.error("Scheduled sync of principal {} failed: {}", principalId, ex.getMessage(), ex);
                    return null;
                }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        log.info("Scheduled mailbox sync finished for {} principal(s)", futures.size());
    }

    public Optional<SyncReport> syncLocked(String principalId) {
        return syncLocked(principalId, maxMessages);
    }

    /**
     * Runs one sync under the cross-node lock.
     * @return empty when another node holds the lock
     */
    public Optional<SyncReport> syncLocked(String principalId, int maxMessages) {
        String nodeId = syncLockService.getNodeId();
        if (!syncLockService.tryLock(principalId, nodeId)) {
            log.debug("Principal {} is already being synced elsewhere, skipping", principalId);
            return Optional.empty();
        }
        try {
            return Optional.of(mailboxSyncService.syncPrincipal(principalId, maxMessages));
        } finally {
            syncLockService.releaseLock(principalId, nodeId);
        }
    }
}
