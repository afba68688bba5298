package mirror.email.app.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * OAuth state for one principal. The {@code version} column backs the compare-and-swap
 * used by the token lifecycle, so concurrent refreshes from several nodes cannot interleave.
 */
@Entity
@Table(name = "credentials")
@Getter
@Setter
@ToString(exclude = "token")
public class Credential {
    @Id
    private String principalId;

    @Embedded
    private OAuthToken token;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CredentialStatus status;

    private Instant refreshStartedAt;

    private Instant updatedAt;

    @Version
    private Long version;
}
