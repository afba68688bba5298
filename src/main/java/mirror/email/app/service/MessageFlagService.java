package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.MailProviderClient;
import mirror.email.app.provider.ProviderError;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.store.MailboxStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies read/star/folder changes to the mirror, then pushes the matching label change to the provider.
 * The local change stands even when the push-back fails.
 */
@Slf4j
@Service
public class MessageFlagService {
    private static final String UNREAD = "UNREAD";
    private static final String STARRED = "STARRED";
    private static final String INBOX = "INBOX";
    private static final String TRASH = "TRASH";

    private final MailboxStore mailboxStore;
    private final TokenLifecycleService tokenLifecycleService;
    private final MailProviderClient providerClient;

    public MessageFlagService(MailboxStore mailboxStore, TokenLifecycleService tokenLifecycleService,
                              MailProviderClient providerClient) {
        this.mailboxStore = mailboxStore;
        this.tokenLifecycleService = tokenLifecycleService;
        this.providerClient = providerClient;
    }

    /**
     * @param snoozeUntil required for {@link FlagAction#SNOOZE}, ignored otherwise
     */
    public FlagResult apply(String principalId, String emailId, FlagAction action, Instant snoozeUntil) {
        if (action == FlagAction.SNOOZE && snoozeUntil == null) {
            throw new IllegalArgumentException("Snooze requires an 'until' instant");
        }
        EmailItem item = mailboxStore.findById(principalId, emailId).orElse(null);
        if (item == null) {
            return FlagResult.notFound();
        }

        Set<String> labels = labelSet(item.getLabels());
        switch (action) {
            case ARCHIVE:
                item.setFolder(MailFolder.ARCHIVE);
                labels.remove(INBOX);
                break;
            case DELETE:
                item.setFolder(MailFolder.TRASH);
                labels.add(TRASH);
                break;
            case MARK_READ:
                item.setRead(true);
                labels.remove(UNREAD);
                break;
            case MARK_UNREAD:
                item.setRead(false);
                labels.add(UNREAD);
                break;
            case STAR:
                item.setStarred(true);
                labels.add(STARRED);
                break;
            case UNSTAR:
                item.setStarred(false);
                labels.remove(STARRED);
                break;
            case SNOOZE:
                item.setFolder(MailFolder.SNOOZED);
                item.setSnoozedUntil(snoozeUntil);
                break;
        }
        item.setLabels(String.join(",", labels));
        EmailItem stored = mailboxStore.upsert(item);

        // Snoozing has no provider counterpart
        if (action == FlagAction.SNOOZE) {
            return FlagResult.applied(stored);
        }
        return pushBack(principalId, stored, action);
    }

    public BulkActionResult applyAll(String principalId, List<String> emailIds, FlagAction action) {
        if (action == FlagAction.SNOOZE) {
            throw new IllegalArgumentException("Snooze is not available as a bulk action");
        }
        int succeeded = 0;
        for (String emailId : emailIds) {
            FlagResult result = apply(principalId, emailId, action, null);
            if (result.getStatus() == FlagResult.Status.NOT_FOUND) {
                log.warn("Bulk {} skipped email {} of principal {}: not found", action.getPathName(), emailId, principalId);
            } else {
                succeeded++;
            }
        }
        log.info("Bulk {} for principal {}: {} succeeded, {} failed out of {}",
            action.getPathName(), principalId, succeeded, emailIds.size() - succeeded, emailIds.size());
        return new BulkActionResult(emailIds.size(), succeeded, emailIds.size() - succeeded);
    }

    private FlagResult pushBack(String principalId, EmailItem item, FlagAction action) {
        TokenResult token = tokenLifecycleService.getValidToken(principalId);
        if (!token.isOk()) {
            log.warn("Could not push {} of message {} to the provider: {}", action.getPathName(), item.getProviderMessageId(), token.getReason());
            return FlagResult.localOnly(item, token.needsReauth(), token.getReason());
        }

        String accessToken = token.getAccessToken();
        String providerId = item.getProviderMessageId();
        ProviderResult<Void> result;
        switch (action) {
            case DELETE:
                result = providerClient.trashMessage(accessToken, providerId);
                break;
            case ARCHIVE:
                result = providerClient.modifyLabels(accessToken, providerId, List.of(), List.of(INBOX));
                break;
            case MARK_READ:
                result = providerClient.modifyLabels(accessToken, providerId, List.of(), List.of(UNREAD));
                break;
            case MARK_UNREAD:
                result = providerClient.modifyLabels(accessToken, providerId, List.of(UNREAD), List.of());
                break;
            case STAR:
                result = providerClient.modifyLabels(accessToken, providerId, List.of(STARRED), List.of());
                break;
            case UNSTAR:
                result = providerClient.modifyLabels(accessToken, providerId, List.of(), List.of(STARRED));
                break;
            default:
                throw new IllegalStateException("No provider counterpart for " + action);
        }

        if (result.isOk()) {
            return FlagResult.applied(item);
        }
        ProviderError error = result.getError();
        if (error.getKind() == ErrorKind.TOKEN_REVOKED) {
            tokenLifecycleService.invalidateAccessToken(principalId, accessToken);
        }
        log.warn("Provider rejected {} of message {}: {} {}", action.getPathName(), providerId, error.getKind(), error.getMessage());
        return FlagResult.localOnly(item, false, error.getMessage());
    }

    private static Set<String> labelSet(String labels) {
        if (labels == null || labels.isBlank()) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(Arrays.asList(labels.split(",")));
    }
}
