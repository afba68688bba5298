package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.SyncCursor;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.MailProviderClient;
import mirror.email.app.provider.MessageDetail;
import mirror.email.app.provider.MessagePage;
import mirror.email.app.provider.ProviderError;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.store.MailboxStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls new provider messages into the local mirror for one principal.
 * <p>
 * Messages are persisted one by one in provider page order. The cursor is written after the
 * messages it describes, and its watermark only advances after a run that drained every page
 * without errors, so an interrupted run is simply repeated and deduplicated next time.
 */
@Slf4j
@Service
public class MailboxSyncService {
    private final TokenLifecycleService tokenLifecycleService;
    private final MailProviderClient providerClient;
    private final MailboxStore mailboxStore;
    private final MessageNormalizer normalizer;
    private final EmailClassificationService classificationService;
    private final Clock clock;
    private final MirrorProperties.Sync settings;

    public MailboxSyncService(TokenLifecycleService tokenLifecycleService,
                              MailProviderClient providerClient,
                              MailboxStore mailboxStore,
                              MessageNormalizer normalizer,
                              EmailClassificationService classificationService,
                              Clock clock,
                              MirrorProperties properties) {
        this.tokenLifecycleService = tokenLifecycleService;
        this.providerClient = providerClient;
        this.mailboxStore = mailboxStore;
        this.normalizer = normalizer;
        this.classificationService = classificationService;
        this.clock = clock;
        this.settings = properties.getSync();
    }

    public SyncReport syncPrincipal(String principalId, int maxMessages) {
        return syncPrincipal(principalId, maxMessages, SyncCancellation.none());
    }

    /**
     * @param maxMessages upper bound on message detail fetches; zero or less means the configured default
     */
    public SyncReport syncPrincipal(String principalId, int maxMessages, SyncCancellation cancellation) {
        int limit = maxMessages > 0 ? maxMessages : settings.getDefaultMaxMessages();

        TokenResult token = tokenLifecycleService.getValidToken(principalId);
        if (token.needsReauth()) {
            log.info("Skipping sync of principal {}: {}", principalId, token.getReason());
            return SyncReport.needsReauth();
        }
        if (!token.isOk()) {
            log.warn("Skipping sync of principal {}: no access token ({})", principalId, token.getReason());
            return new SyncReport(SyncReport.Outcome.ABORTED, 0, 0, List.of(SyncError.of(null, token.getError())));
        }
        String accessToken = token.getAccessToken();

        Instant previousWatermark = mailboxStore.getCursor(principalId).map(SyncCursor::getWatermark).orElse(null);
        String query = buildQuery(previousWatermark);

        List<SyncError> errors = new ArrayList<>();
        SyncReport.Outcome outcome = SyncReport.Outcome.COMPLETED;
        int fetched = 0;
        int ingested = 0;
        int pages = 0;
        boolean drained = false;
        String pageToken = null;
        String lastPersistedId = null;
        Instant newestSeen = null;

        pageLoop:
        while (fetched < limit && pages < settings.getMaxPages()) {
            if (cancellation.isCancelled(clock.instant())) {
                outcome = SyncReport.Outcome.CANCELLED;
                break;
            }
            ProviderResult<MessagePage> listed = providerClient.listMessageIds(accessToken, pageToken, settings.getPageSize(), query);
            pages++;
            if (!listed.isOk()) {
                ProviderError error = listed.getError();
                errors.add(SyncError.of(null, error));
                if (error.getKind() == ErrorKind.TOKEN_REVOKED) {
                    tokenLifecycleService.invalidateAccessToken(principalId, accessToken);
                }
                log.warn("Listing messages for principal {} failed with {}: {}", principalId, error.getKind(), error.getMessage());
                outcome = SyncReport.Outcome.ABORTED;
                break;
            }
            MessagePage page = listed.getValue();

            for (String messageId : page.getIds()) {
                if (mailboxStore.existsByProviderId(principalId, messageId)) {
                    log.debug("Message {} of principal {} already mirrored", messageId, principalId);
                    continue;
                }
                if (fetched >= limit) {
                    break pageLoop;
                }
                if (cancellation.isCancelled(clock.instant())) {
                    outcome = SyncReport.Outcome.CANCELLED;
                    break pageLoop;
                }
                ProviderResult<MessageDetail> result = providerClient.fetchMessage(accessToken, messageId);
                fetched++;
                if (!result.isOk()) {
                    ProviderError error = result.getError();
                    errors.add(SyncError.of(messageId, error));
                    if (error.getKind() == ErrorKind.TOKEN_REVOKED || error.getKind() == ErrorKind.RATE_LIMITED) {
                        if (error.getKind() == ErrorKind.TOKEN_REVOKED) {
                            tokenLifecycleService.invalidateAccessToken(principalId, accessToken);
                        }
                        log.warn("Aborting sync of principal {} at message {}: {}", principalId, messageId, error.getMessage());
                        outcome = SyncReport.Outcome.ABORTED;
                        break pageLoop;
                    }
                    log.warn("Skipping message {} of principal {}: {} {}", messageId, principalId, error.getKind(), error.getMessage());
                    continue;
                }
                // A cancellation that arrived during the fetch discards the fetched message
                if (cancellation.isCancelled(clock.instant())) {
                    outcome = SyncReport.Outcome.CANCELLED;
                    break pageLoop;
                }

                MessageDetail detail = result.getValue();
                EmailItem item = normalizer.normalize(principalId, detail);
                if (settings.isClassifyOnIngest()) {
                    enrich(item);
                }
                mailboxStore.upsert(item);
                ingested++;
                lastPersistedId = messageId;
                Instant seen = detail.getInternalDate() != null ? detail.getInternalDate() : item.getReceivedAt();
                if (newestSeen == null || seen.isAfter(newestSeen)) {
                    newestSeen = seen;
                }
            }

            if (!page.hasNextPage()) {
                drained = true;
                break;
            }
            pageToken = page.getNextPageToken();
        }

        if (outcome != SyncReport.Outcome.CANCELLED && ingested > 0) {
            Instant watermark = previousWatermark;
            if (outcome == SyncReport.Outcome.COMPLETED && drained && errors.isEmpty()
                && (watermark == null || newestSeen.isAfter(watermark))) {
                watermark = newestSeen;
            }
            mailboxStore.setCursor(new SyncCursor(principalId, lastPersistedId, watermark, clock.instant()));
        }

        SyncReport report = new SyncReport(outcome, fetched, ingested, List.copyOf(errors));
        log.info("Sync of principal {} finished: outcome={}, fetched={}, ingested={}, errors={}, pages={}",
            principalId, outcome, fetched, ingested, errors.size(), pages);
        return report;
    }

    String buildQuery(Instant watermark) {
        String base = settings.getBaseQuery() != null ? settings.getBaseQuery().trim() : "";
        if (watermark == null) {
            return base;
        }
        // after: is exclusive and second-granular; overlap is absorbed by dedup
        String after = "after:" + (watermark.getEpochSecond() - 1);
        return base.isEmpty() ? after : base + " " + after;
    }

    private void enrich(EmailItem item) {
        String text = item.getBody() != null && !item.getBody().isEmpty() ? item.getBody() : item.getSnippet();
        String content = Objects.toString(item.getSubject(), "") + "\n\n" + Objects.toString(text, "");
        Classification classification;
        try {
            classification = classificationService.classify(content);
        } catch (EmailClassificationService.QuotaException e) {
            log.warn("AI quota exhausted while classifying message {}, storing it uncategorized", item.getProviderMessageId());
            classification = Classification.fallback();
        } catch (RuntimeException e) {
            log.warn("Classification of message {} failed: {}", item.getProviderMessageId(), e.getMessage());
            classification = Classification.fallback();
        }
        item.setCategory(classification.getCategory());
        item.setSummary(classification.getSummary());
        item.setSentiment(classification.getSentiment());
        item.setImportance(classification.getImportance());
    }
}
