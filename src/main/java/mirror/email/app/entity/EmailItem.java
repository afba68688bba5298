package mirror.email.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "email_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_email_items_principal_provider_id",
                columnNames = {"principal_id", "provider_message_id"}),
        indexes = @Index(name = "idx_email_items_principal_received", columnList = "principal_id, received_at"))
@Data
public class EmailItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "principal_id", nullable = false)
    private String principalId;

    @Column(name = "provider_message_id", nullable = false)
    private String providerMessageId;

    private String threadId;

    @Column(length = 1000)
    private String subject;

    @Column(length = 1000)
    private String sender;

    @Column(length = 1000)
    private String recipient;

    @Column(length = 1000)
    private String snippet;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "is_starred")
    private boolean starred;

    @Enumerated(EnumType.STRING)
    private MailFolder folder;

    private Instant snoozedUntil;

    // Provider label ids, comma separated
    @Column(length = 2000)
    private String labels;

    @Enumerated(EnumType.STRING)
    private MessageDirection direction;

    // AI enrichment
    private String category;

    @Column(columnDefinition = "TEXT")
    private String summary;

    private String sentiment;

    private Integer importance;

    private Instant ingestedAt;
}
