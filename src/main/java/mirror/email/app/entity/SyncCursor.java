package mirror.email.app.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-principal ingestion progress.
 * {@code watermark} is the newest receipt time covered by a run that drained every page; it never moves back.
 */
@Entity
@Table(name = "sync_cursors")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncCursor {
    @Id
    private String principalId;

    private String lastMessageId;

    private Instant watermark;

    private Instant updatedAt;
}
