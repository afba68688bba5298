package mirror.email.app.repository;

import mirror.email.app.entity.Credential;
import mirror.email.app.entity.CredentialStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CredentialRepository extends JpaRepository<Credential, String> {
    List<Credential> findByStatusNot(CredentialStatus status);
}
