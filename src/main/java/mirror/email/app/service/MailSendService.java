package mirror.email.app.service;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.entity.MessageDirection;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.MailProviderClient;
import mirror.email.app.provider.ProviderError;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.provider.SentMessage;
import mirror.email.app.store.MailboxStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Sends mail as a principal and records the outbound copy under the provider's id,
 * so the next sync recognizes it instead of ingesting it twice.
 */
@Slf4j
@Service
public class MailSendService {
    private static final int SNIPPET_LENGTH = 200;

    private final TokenLifecycleService tokenLifecycleService;
    private final MailProviderClient providerClient;
    private final MailboxStore mailboxStore;
    private final Clock clock;

    public MailSendService(TokenLifecycleService tokenLifecycleService, MailProviderClient providerClient,
                           MailboxStore mailboxStore, Clock clock) {
        this.tokenLifecycleService = tokenLifecycleService;
        this.providerClient = providerClient;
        this.mailboxStore = mailboxStore;
        this.clock = clock;
    }

    public SendResult sendMessage(String principalId, String to, String subject, String body) {
        if (to == null || to.isBlank()) {
            return SendResult.failed(ProviderError.of(ErrorKind.MALFORMED_REQUEST, "Recipient address is required"));
        }

        TokenResult token = tokenLifecycleService.getValidToken(principalId);
        if (token.needsReauth()) {
            return SendResult.needsReauth(token.getReason());
        }
        if (!token.isOk()) {
            return SendResult.failed(token.getError());
        }

        ProviderResult<SentMessage> result = providerClient.sendMessage(token.getAccessToken(), to, subject, body);
        if (!result.isOk()) {
            ProviderError error = result.getError();
            if (error.getKind() == ErrorKind.TOKEN_REVOKED) {
                tokenLifecycleService.invalidateAccessToken(principalId, token.getAccessToken());
            }
            log.warn("Sending mail for principal {} failed with {}: {}", principalId, error.getKind(), error.getMessage());
            return SendResult.failed(error);
        }

        SentMessage sent = result.getValue();
        Instant now = clock.instant();
        EmailItem item = new EmailItem();
        item.setPrincipalId(principalId);
        item.setProviderMessageId(sent.getProviderId());
        item.setThreadId(sent.getThreadId());
        item.setSubject(subject);
        item.setRecipient(to);
        item.setBody(body);
        item.setSnippet(snippetOf(body));
        item.setReceivedAt(now);
        item.setRead(true);
        item.setFolder(MailFolder.SENT);
        item.setLabels("SENT");
        item.setDirection(MessageDirection.OUTBOUND);
        item.setIngestedAt(now);

        EmailItem stored = mailboxStore.upsert(item);
        log.info("Sent message {} for principal {}", sent.getProviderId(), principalId);
        return SendResult.sent(stored);
    }

    /**
     * First 200 characters of the body, shortened by one when the cut would split a surrogate pair.
     */
    static String snippetOf(String body) {
        if (body == null || body.length() <= SNIPPET_LENGTH) {
            return body;
        }
        int end = Character.isHighSurrogate(body.charAt(SNIPPET_LENGTH - 1)) ? SNIPPET_LENGTH - 1 : SNIPPET_LENGTH;
        return body.substring(0, end);
    }
}
