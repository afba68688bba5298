package mirror.email.app.service;

import mirror.email.app.entity.EmailItem;
import mirror.email.app.entity.MailFolder;
import mirror.email.app.provider.ErrorKind;
import mirror.email.app.provider.MailProviderClient;
import mirror.email.app.provider.ProviderResult;
import mirror.email.app.store.InMemoryMailboxStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageFlagServiceTest {
    private static final String PRINCIPAL = "user123";
    private static final String TOKEN = "access_token";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private TokenLifecycleService tokenLifecycleService;

    @Mock
    private MailProviderClient providerClient;

    private InMemoryMailboxStore mailboxStore;
    private MessageFlagService flagService;
    private EmailItem item;

    @BeforeEach
    void setUp() {
        mailboxStore = new InMemoryMailboxStore();
        flagService = new MessageFlagService(mailboxStore, tokenLifecycleService, providerClient);

        item = new EmailItem();
        item.setPrincipalId(PRINCIPAL);
        item.setProviderMessageId("m1");
        item.setSubject("Invoice");
        item.setFolder(MailFolder.INBOX);
        item.setLabels("INBOX,UNREAD");
        item = mailboxStore.upsert(item);
    }

    private void givenValidToken() {
        when(tokenLifecycleService.getValidToken(PRINCIPAL)).thenReturn(TokenResult.ok(TOKEN, NOW.plusSeconds(3600)));
    }

    @Test
    void apply_MarkRead_ShouldUpdateMirrorAndRemoveUnreadLabel() {
        // Given
        givenValidToken();
        when(providerClient.modifyLabels(TOKEN, "m1", List.of(), List.of("UNREAD"))).thenReturn(ProviderResult.ok());

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.MARK_READ, null);

        // Then
        assertEquals(FlagResult.Status.APPLIED, result.getStatus());
        EmailItem stored = mailboxStore.findByProviderId(PRINCIPAL, "m1").orElseThrow();
        assertTrue(stored.isRead());
        assertEquals("INBOX", stored.getLabels());
    }

    @Test
    void apply_Archive_ShouldMoveOutOfInbox() {
        // Given
        givenValidToken();
        when(providerClient.modifyLabels(TOKEN, "m1", List.of(), List.of("INBOX"))).thenReturn(ProviderResult.ok());

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.ARCHIVE, null);

        // Then
        assertEquals(FlagResult.Status.APPLIED, result.getStatus());
        assertEquals(MailFolder.ARCHIVE, result.getItem().getFolder());
        assertEquals("UNREAD", result.getItem().getLabels());
    }

    @Test
    void apply_Delete_ShouldTrashAtProvider() {
        // Given
        givenValidToken();
        when(providerClient.trashMessage(TOKEN, "m1")).thenReturn(ProviderResult.ok());

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.DELETE, null);

        // Then
        assertEquals(MailFolder.TRASH, result.getItem().getFolder());
        verify(providerClient, never()).modifyLabels(anyString(), anyString(), anyList(), anyList());
    }

    @Test
    void apply_Star_WhenProviderFails_ShouldKeepLocalChange() {
        // Given
        givenValidToken();
        when(providerClient.modifyLabels(TOKEN, "m1", List.of("STARRED"), List.of()))
            .thenReturn(ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, "modify labels of m1 failed with HTTP 503"));

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.STAR, null);

        // Then
        assertEquals(FlagResult.Status.LOCAL_ONLY, result.getStatus());
        assertFalse(result.isReauthRequired());
        assertTrue(mailboxStore.findByProviderId(PRINCIPAL, "m1").orElseThrow().isStarred());
    }

    @Test
    void apply_WithRevokedToken_ShouldInvalidateAccessToken() {
        // Given
        givenValidToken();
        when(providerClient.modifyLabels(TOKEN, "m1", List.of("UNREAD"), List.of()))
            .thenReturn(ProviderResult.failure(ErrorKind.TOKEN_REVOKED, "modify labels of m1 failed with HTTP 401"));

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.MARK_UNREAD, null);

        // Then
        assertEquals(FlagResult.Status.LOCAL_ONLY, result.getStatus());
        verify(tokenLifecycleService).invalidateAccessToken(PRINCIPAL, TOKEN);
    }

    @Test
    void apply_WithoutCredential_ShouldApplyLocallyAndAskForReauth() {
        // Given
        when(tokenLifecycleService.getValidToken(PRINCIPAL)).thenReturn(TokenResult.needsReauth("No credential stored"));

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.MARK_READ, null);

        // Then
        assertEquals(FlagResult.Status.LOCAL_ONLY, result.getStatus());
        assertTrue(result.isReauthRequired());
        assertTrue(mailboxStore.findByProviderId(PRINCIPAL, "m1").orElseThrow().isRead());
        verifyNoInteractions(providerClient);
    }

    @Test
    void apply_Snooze_ShouldStayLocal() {
        // Given
        Instant until = NOW.plusSeconds(86400);

        // When
        FlagResult result = flagService.apply(PRINCIPAL, item.getId(), FlagAction.SNOOZE, until);

        // Then
        assertEquals(FlagResult.Status.APPLIED, result.getStatus());
        assertEquals(MailFolder.SNOOZED, result.getItem().getFolder());
        assertEquals(until, result.getItem().getSnoozedUntil());
        verifyNoInteractions(tokenLifecycleService, providerClient);
    }

    @Test
    void apply_SnoozeWithoutUntil_ShouldThrowException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> {
            flagService.apply(PRINCIPAL, item.getId(), FlagAction.SNOOZE, null);
        });
    }

    @Test
    void apply_WithOtherPrincipalsEmail_ShouldReportNotFound() {
        // When
        FlagResult result = flagService.apply("intruder", item.getId(), FlagAction.DELETE, null);

        // Then
        assertEquals(FlagResult.Status.NOT_FOUND, result.getStatus());
        assertEquals(MailFolder.INBOX, mailboxStore.findByProviderId(PRINCIPAL, "m1").orElseThrow().getFolder());
    }

    @Test
    void applyAll_WithUnknownIds_ShouldCountThemAsFailed() {
        // Given
        givenValidToken();
        when(providerClient.modifyLabels(TOKEN, "m1", List.of(), List.of("UNREAD"))).thenReturn(ProviderResult.ok());

        // When
        BulkActionResult result = flagService.applyAll(PRINCIPAL, List.of(item.getId(), "missing-1", "missing-2"), FlagAction.MARK_READ);

        // Then
        assertEquals(3, result.getRequested());
        assertEquals(1, result.getSucceeded());
        assertEquals(2, result.getFailed());
    }

    @Test
    void applyAll_WithSnooze_ShouldThrowException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> {
            flagService.applyAll(PRINCIPAL, List.of(item.getId()), FlagAction.SNOOZE);
        });
    }

    @Test
    void fromPathName_WithUnknownAction_ShouldThrowException() {
        assertEquals(FlagAction.MARK_UNREAD, FlagAction.fromPathName("mark-unread"));
        assertThrows(IllegalArgumentException.class, () -> FlagAction.fromPathName("explode"));
    }
}
