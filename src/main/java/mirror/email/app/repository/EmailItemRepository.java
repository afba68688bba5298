package mirror.email.app.repository;

import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmailItemRepository extends JpaRepository<EmailItem, String> {
    boolean existsByPrincipalIdAndProviderMessageId(String principalId, String providerMessageId);

    Optional<EmailItem> findByPrincipalIdAndProviderMessageId(String principalId, String providerMessageId);

    Optional<EmailItem> findByIdAndPrincipalId(String id, String principalId);

    List<EmailItem> findByPrincipalIdAndFolderOrderByReceivedAtDesc(String principalId, MailFolder folder, Pageable pageable);

    long countByPrincipalIdAndFolder(String principalId, MailFolder folder);

    long countByPrincipalIdAndFolderAndReadFalse(String principalId, MailFolder folder);
}
