package mirror.email.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class User {
    @Id
    private String id; // OAuth subject

    private String primaryEmail;

    private String displayName;

    private Instant createdAt;

    private Instant lastLoginAt;
}
