package mirror.email.app.controller;

import mirror.email.app.controller.dto.BulkActionRequest;
import mirror.email.app.controller.dto.SnoozeRequest;
import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.entity.User;
import mirror.email.app.repository.EmailItemRepository;
import mirror.email.app.service.BulkActionResult;
import mirror.email.app.service.CredentialService;
import mirror.email.app.service.FlagAction;
import mirror.email.app.service.FlagResult;
import mirror.email.app.service.MessageFlagService;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/messages")
public class MessageActionController {
    private static final int MAX_PAGE_SIZE = 200;

    private final CredentialService credentialService;
    private final MessageFlagService messageFlagService;
    private final EmailItemRepository emailItemRepository;

    public MessageActionController(
            CredentialService credentialService,
            MessageFlagService messageFlagService,
            EmailItemRepository emailItemRepository) {
        this.credentialService = credentialService;
        this.messageFlagService = messageFlagService;
        this.emailItemRepository = emailItemRepository;
    }

    @GetMapping
    public List<EmailItem> list(@RequestParam(defaultValue = "INBOX") MailFolder folder,
                                @RequestParam(defaultValue = "0") int page,
                                @RequestParam(defaultValue = "50") int size,
                                Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        PageRequest pageRequest = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        return emailItemRepository.findByPrincipalIdAndFolderOrderByReceivedAtDesc(user.getId(), folder, pageRequest);
    }

    @PostMapping("/{id}/{action}")
    public ResponseEntity<Map<String, Object>> apply(@PathVariable String id,
                                                     @PathVariable String action,
                                                     @RequestBody(required = false) SnoozeRequest snooze,
                                                     Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        FlagAction flagAction = FlagAction.fromPathName(action);
        Instant until = flagAction == FlagAction.SNOOZE ? parseUntil(snooze) : null;

        FlagResult result = messageFlagService.apply(user.getId(), id, flagAction, until);
        Map<String, Object> body = new HashMap<>();
        body.put("status", result.getStatus().name());
        if (result.getStatus() == FlagResult.Status.NOT_FOUND) {
            body.put("message", result.getReason());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        body.put("id", result.getItem().getId());
        body.put("folder", result.getItem().getFolder());
        body.put("read", result.getItem().isRead());
        body.put("starred", result.getItem().isStarred());
        if (result.getStatus() == FlagResult.Status.LOCAL_ONLY) {
            body.put("reauthRequired", result.isReauthRequired());
            body.put("message", result.getReason());
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/bulk-action")
    public ResponseEntity<BulkActionResult> bulk(@RequestBody BulkActionRequest request, Authentication authentication) {
        User user = credentialService.getOrCreateUser(authentication);
        if (request.getEmailIds() == null || request.getEmailIds().isEmpty()) {
            throw new IllegalArgumentException("emailIds must not be empty");
        }
        FlagAction action = FlagAction.fromPathName(request.getAction());
        return ResponseEntity.ok(messageFlagService.applyAll(user.getId(), request.getEmailIds(), action));
    }

    private static Instant parseUntil(SnoozeRequest snooze) {
        if (snooze == null || snooze.getUntil() == null || snooze.getUntil().isBlank()) {
            throw new IllegalArgumentException("Snooze requires an 'until' instant");
        }
        try {
            return Instant.parse(snooze.getUntil().trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid 'until' instant: " + snooze.getUntil(), e);
        }
    }
}
