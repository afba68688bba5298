package mirror.email.app.service;

import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.entity.MessageDirection;
import mirror.email.app.provider.MessageDetail;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Maps a provider message onto the local {@link EmailItem} shape.
 */
@Component
public class MessageNormalizer {
    static final String LABEL_INBOX = "INBOX";
    static final String LABEL_SENT = "SENT";
    static final String LABEL_DRAFT = "DRAFT";
    static final String LABEL_SPAM = "SPAM";
    static final String LABEL_TRASH = "TRASH";
    static final String LABEL_UNREAD = "UNREAD";
    static final String LABEL_STARRED = "STARRED";

    private final Clock clock;

    public MessageNormalizer(Clock clock) {
        this.clock = clock;
    }

    public EmailItem normalize(String principalId, MessageDetail detail) {
        Instant now = clock.instant();
        List<String> labels = detail.getLabelIds();

        EmailItem item = new EmailItem();
        item.setPrincipalId(principalId);
        item.setProviderMessageId(detail.getId());
        item.setThreadId(detail.getThreadId());
        item.setSubject(detail.getSubject());
        item.setSender(detail.getFrom());
        item.setRecipient(detail.getTo());
        item.setSnippet(detail.getSnippet());
        item.setBody(detail.getBody());
        item.setReceivedAt(receivedAt(detail, now));
        item.setRead(!labels.contains(LABEL_UNREAD));
        item.setStarred(labels.contains(LABEL_STARRED));
        item.setFolder(folderOf(labels));
        item.setLabels(String.join(",", labels));
        item.setDirection(labels.contains(LABEL_SENT) ? MessageDirection.OUTBOUND : MessageDirection.INBOUND);
        item.setIngestedAt(now);
        return item;
    }

    /**
     * The Date header, or the time of ingestion when it was missing or unparseable.
     */
    static Instant receivedAt(MessageDetail detail, Instant now) {
        return detail.getDate() != null ? detail.getDate() : now;
    }

    static MailFolder folderOf(List<String> labels) {
        if (labels.contains(LABEL_TRASH)) {
            return MailFolder.TRASH;
        }
        if (labels.contains(LABEL_SPAM)) {
            return MailFolder.SPAM;
        }
        if (labels.contains(LABEL_DRAFT)) {
            return MailFolder.DRAFTS;
        }
        if (labels.contains(LABEL_INBOX)) {
            return MailFolder.INBOX;
        }
        if (labels.contains(LABEL_SENT)) {
            return MailFolder.SENT;
        }
        return MailFolder.ARCHIVE;
    }
}
