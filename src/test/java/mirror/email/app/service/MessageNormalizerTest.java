package mirror.email.app.service;

import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.entity.MessageDirection;
import mirror.email.app.provider.MessageDetail;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageNormalizerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final MessageNormalizer normalizer = new MessageNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void normalize_WithInboxMessage_ShouldCopyFieldsAndFlags() {
        // Given
        Instant sentAt = Instant.parse("2024-04-30T08:00:00Z");
        MessageDetail detail = MessageDetail.builder()
            .id("m1")
            .threadId("t1")
            .subject("Hello")
            .from("alice@example.com")
            .to("bob@example.com")
            .date(sentAt)
            .internalDate(sentAt.plusSeconds(5))
            .snippet("Hi")
            .body("Hi Bob")
            .labelId("INBOX")
            .labelId("UNREAD")
            .labelId("STARRED")
            .build();

        // When
        EmailItem item = normalizer.normalize("user123", detail);

        // Then
        assertEquals("user123", item.getPrincipalId());
        assertEquals("m1", item.getProviderMessageId());
        assertEquals("alice@example.com", item.getSender());
        assertEquals(sentAt, item.getReceivedAt());
        assertFalse(item.isRead());
        assertTrue(item.isStarred());
        assertEquals(MailFolder.INBOX, item.getFolder());
        assertEquals("INBOX,UNREAD,STARRED", item.getLabels());
        assertEquals(MessageDirection.INBOUND, item.getDirection());
        assertEquals(NOW, item.getIngestedAt());
        assertNull(item.getId());
    }

    @Test
    void normalize_WithoutDate_ShouldUseIngestionTime() {
        // Given
        MessageDetail detail = MessageDetail.builder()
            .id("m2")
            .internalDate(Instant.parse("2024-04-01T00:00:00Z"))
            .labelId("SENT")
            .build();

        // When
        EmailItem item = normalizer.normalize("user123", detail);

        // Then
        assertEquals(NOW, item.getReceivedAt());
        assertEquals(MessageDirection.OUTBOUND, item.getDirection());
        assertEquals(MailFolder.SENT, item.getFolder());
    }

    @Test
    void folderOf_WithCompetingLabels_ShouldPreferTrashThenSpamThenDrafts() {
        assertEquals(MailFolder.TRASH, MessageNormalizer.folderOf(List.of("INBOX", "TRASH", "SPAM")));
        assertEquals(MailFolder.SPAM, MessageNormalizer.folderOf(List.of("INBOX", "SPAM")));
        assertEquals(MailFolder.DRAFTS, MessageNormalizer.folderOf(List.of("DRAFT", "SENT")));
        assertEquals(MailFolder.INBOX, MessageNormalizer.folderOf(List.of("SENT", "INBOX")));
        assertEquals(MailFolder.ARCHIVE, MessageNormalizer.folderOf(List.of("CATEGORY_UPDATES")));
    }
}
