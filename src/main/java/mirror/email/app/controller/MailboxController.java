package mirror.email.app.controller;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.controller.dto.SendMailRequest;
import mirror.email.app.entity.CredentialStatus;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.entity.User;
import mirror.email.app.provider.ProviderError;
import mirror.email.app.repository.EmailItemRepository;
import mirror.email.app.service.CredentialService;
import mirror.email.app.service.CredentialView;
import mirror.email.app.service.MailSendService;
import mirror.email.app.service.SendResult;
import mirror.email.app.service.SyncReport;
import mirror.email.app.service.SyncScheduler;
import mirror.email.app.service.TokenLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Manual sync, send, mailbox counts and credential diagnostics for the signed-in principal.
 */
@Slf4j
@RestController
@RequestMapping("/api/mailbox")
public class MailboxController {
    private final CredentialService credentialService;
    private final SyncScheduler syncScheduler;
    private final MailSendService mailSendService;
    private final TokenLifecycleService tokenLifecycleService;
    private final EmailItemRepository emailItemRepository;

    public MailboxController(
            CredentialService credentialService,
            SyncScheduler syncScheduler,
            MailSendService mailSendService,
            TokenLifecycleService tokenLifecycleService,
            EmailItemRepository emailItemRepository) {
        this.credentialService = credentialService;
        this.syncScheduler = syncScheduler;
        this.mailSendService = mailSendService;
        this.tokenLifecycleService = tokenLifecycleService;
        this.emailItemRepository = emailItemRepository;
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync(@RequestParam(required = false) Integer maxMessages,
                                                    Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        return runSync(user.getId(), maxMessages);
    }

    /**
     * Sync any principal by id; restricted to operators.
     */
    @PostMapping("/sync/{principalId}")
    public ResponseEntity<Map<String, Object>> syncPrincipal(@PathVariable String principalId,
                                                             @RequestParam(required = false) Integer maxMessages) {
        return runSync(principalId, maxMessages);
    }

    @PostMapping("/send")
    public ResponseEntity<Map<String, Object>> send(@RequestBody SendMailRequest request, Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        SendResult result = mailSendService.sendMessage(user.getId(), request.getTo(), request.getSubject(), request.getBody());

        Map<String, Object> body = new HashMap<>();
        body.put("status", result.getStatus().name());
        switch (result.getStatus()) {
            case SENT:
                EmailItem item = result.getItem();
                body.put("id", item.getId());
                body.put("providerMessageId", item.getProviderMessageId());
                body.put("threadId", item.getThreadId());
                return ResponseEntity.ok(body);
            case NEEDS_REAUTH:
                body.put("reauthRequired", true);
                body.put("message", result.getReason());
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
            default:
                ProviderError error = result.getError();
                body.put("errorKind", error.getKind().name());
                body.put("message", error.getMessage());
                if (error.getRetryAfter() != null) {
                    body.put("retryAfterSeconds", error.getRetryAfter().getSeconds());
                }
                return ResponseEntity.status(statusOf(error)).body(body);
        }
    }

    /**
     * Sidebar counts from the local mirror: unread inbox, spam and trash. No provider call is made.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        String principalId = user.getId();

        Map<String, Object> body = new HashMap<>();
        body.put("inbox", emailItemRepository.countByPrincipalIdAndFolderAndReadFalse(principalId, MailFolder.INBOX));
        body.put("spam", emailItemRepository.countByPrincipalIdAndFolder(principalId, MailFolder.SPAM));
        body.put("trash", emailItemRepository.countByPrincipalIdAndFolder(principalId, MailFolder.TRASH));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/credential")
    public ResponseEntity<Map<String, Object>> credential(Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        Optional<CredentialView> view = tokenLifecycleService.describe(user.getId());

        Map<String, Object> body = new HashMap<>();
        body.put("principalId", user.getId());
        body.put("email", user.getPrimaryEmail());
        if (view.isEmpty()) {
            body.put("status", "MISSING");
            body.put("reauthRequired", true);
            return ResponseEntity.ok(body);
        }
        CredentialView credential = view.get();
        body.put("status", credential.getStatus().name());
        body.put("expiry", credential.getExpiry());
        body.put("hasRefreshToken", credential.isHasRefreshToken());
        body.put("scopes", credential.getScopes());
        body.put("updatedAt", credential.getUpdatedAt());
        body.put("reauthRequired", credential.getStatus() == CredentialStatus.NEEDS_REAUTH);
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, Object>> runSync(String principalId, Integer maxMessages) {
        Optional<SyncReport> outcome = syncScheduler.syncLocked(principalId, maxMessages != null ? maxMessages : 0);
        Map<String, Object> body = new HashMap<>();
        if (outcome.isEmpty()) {
            body.put("status", "IN_PROGRESS");
            body.put("message", "A sync of this mailbox is already running");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }

        SyncReport report = outcome.get();
        body.put("status", report.getOutcome().name());
        body.put("fetched", report.getFetched());
        body.put("ingested", report.getIngested());
        body.put("errors", report.getErrors());
        switch (report.getOutcome()) {
            case NEEDS_REAUTH:
                body.put("reauthRequired", true);
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
            case ABORTED:
                boolean retryable = report.getErrors().stream().anyMatch(error -> error.getKind().isRetryable());
                return ResponseEntity.status(retryable ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY).body(body);
            default:
                return ResponseEntity.ok(body);
        }
    }

    static HttpStatus statusOf(ProviderError error) {
        switch (error.getKind()) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case MALFORMED_REQUEST:
                return HttpStatus.BAD_REQUEST;
            default:
                return error.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        }
    }
}
