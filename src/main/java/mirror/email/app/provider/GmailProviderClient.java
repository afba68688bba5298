package mirror.email.app.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import lombok.extern.slf4j.Slf4j;
import mirror.email.app.config.MirrorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Gmail REST implementation of {@link MailProviderClient}.
 * Every HTTP failure is mapped to a {@link ProviderResult} status; nothing is thrown to the caller.
 */
@Slf4j
@Service
public class GmailProviderClient implements MailProviderClient {
    static final String DEFAULT_SUBJECT = "(No Subject)";
    static final String DEFAULT_SENDER = "Unknown";

    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String USER_ID = "me";

    private final HttpTransport httpTransport;
    private final String applicationName;
    private final RawMessageBuilder rawMessageBuilder = new RawMessageBuilder();

    @Autowired
    public GmailProviderClient(MirrorProperties properties) throws GeneralSecurityException, IOException {
        this(GoogleNetHttpTransport.newTrustedTransport(), properties.getProvider().getApplicationName());
    }

    GmailProviderClient(HttpTransport httpTransport, String applicationName) {
        this.httpTransport = httpTransport;
        this.applicationName = applicationName;
    }

    private Gmail gmail(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(JSON_FACTORY)
            .build();
        credential.setAccessToken(accessToken);

        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential)
            .setApplicationName(applicationName)
            .build();
    }

    @Override
    public ProviderResult<MessagePage> listMessageIds(String accessToken, String pageToken, int pageSize, String query) {
        try {
            Gmail.Users.Messages.List request = gmail(accessToken).users().messages().list(USER_ID)
                .setMaxResults((long) pageSize);
            if (pageToken != null && !pageToken.isEmpty()) {
                request.setPageToken(pageToken);
            }
            if (query != null && !query.isBlank()) {
                request.setQ(query);
            }
            ListMessagesResponse response = request.execute();

            List<String> ids = new ArrayList<>();
            if (response.getMessages() != null) {
                for (Message messageRef : response.getMessages()) {
                    if (messageRef.getId() != null) {
                        ids.add(messageRef.getId());
                    }
                }
            }
            return ProviderResult.ok(new MessagePage(ids, response.getNextPageToken()));
        } catch (HttpResponseException e) {
            return classify(e, "list messages");
        } catch (IOException e) {
            return transientFailure(e, "list messages");
        }
    }

    @Override
    public ProviderResult<MessageDetail> fetchMessage(String accessToken, String messageId) {
        try {
            Message message = gmail(accessToken).users().messages().get(USER_ID, messageId)
                .setFormat("full")
                .execute();
            if (message.getId() == null || message.getPayload() == null) {
                return ProviderResult.failure(ErrorKind.MALFORMED_RESPONSE, "Message " + messageId + " came back without id or payload");
            }
            return ProviderResult.ok(toDetail(message));
        } catch (HttpResponseException e) {
            return classify(e, "fetch message " + messageId);
        } catch (IOException e) {
            return transientFailure(e, "fetch message " + messageId);
        }
    }

    @Override
    public ProviderResult<SentMessage> sendMessage(String accessToken, String to, String subject, String body) {
        if (to == null || to.isBlank()) {
            return ProviderResult.failure(ErrorKind.MALFORMED_REQUEST, "Recipient address is required");
        }
        try {
            Message outgoing = new Message().encodeRaw(rawMessageBuilder.build(to, subject, body));
            Message sent = gmail(accessToken).users().messages().send(USER_ID, outgoing).execute();
            if (sent.getId() == null) {
                return ProviderResult.failure(ErrorKind.MALFORMED_RESPONSE, "Send response carried no message id");
            }
            return ProviderResult.ok(new SentMessage(sent.getId(), sent.getThreadId()));
        } catch (HttpResponseException e) {
            return classify(e, "send message");
        } catch (IOException e) {
            return transientFailure(e, "send message");
        }
    }

    @Override
    public ProviderResult<Void> modifyLabels(String accessToken, String messageId, List<String> addLabelIds, List<String> removeLabelIds) {
        try {
            ModifyMessageRequest mods = new ModifyMessageRequest()
                .setAddLabelIds(addLabelIds)
                .setRemoveLabelIds(removeLabelIds);
            gmail(accessToken).users().messages().modify(USER_ID, messageId, mods).execute();
            return ProviderResult.ok();
        } catch (HttpResponseException e) {
            return classify(e, "modify labels of " + messageId);
        } catch (IOException e) {
            return transientFailure(e, "modify labels of " + messageId);
        }
    }

    @Override
    public ProviderResult<Void> trashMessage(String accessToken, String messageId) {
        try {
            gmail(accessToken).users().messages().trash(USER_ID, messageId).execute();
            return ProviderResult.ok();
        } catch (HttpResponseException e) {
            return classify(e, "trash message " + messageId);
        } catch (IOException e) {
            return transientFailure(e, "trash message " + messageId);
        }
    }

    private MessageDetail toDetail(Message message) {
        MessagePart payload = message.getPayload();
        List<MessagePartHeader> headers = payload.getHeaders() != null ? payload.getHeaders() : List.of();

        String dateHeader = header(headers, "Date", null);
        MessageDetail.MessageDetailBuilder detail = MessageDetail.builder()
            .id(message.getId())
            .threadId(message.getThreadId())
            .subject(header(headers, "Subject", DEFAULT_SUBJECT))
            .from(header(headers, "From", DEFAULT_SENDER))
            .to(header(headers, "To", null))
            .date(dateHeader != null ? parseDate(dateHeader) : null)
            .internalDate(message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null)
            .snippet(message.getSnippet())
            .body(extractPlainText(payload));
        if (message.getLabelIds() != null) {
            detail.labelIds(message.getLabelIds());
        }
        return detail.build();
    }

    /**
     * First header whose name matches exactly. Header names are compared case-sensitively.
     */
    static String header(List<MessagePartHeader> headers, String name, String defaultValue) {
        for (MessagePartHeader header : headers) {
            if (name.equals(header.getName()) && header.getValue() != null) {
                return header.getValue();
            }
        }
        return defaultValue;
    }

    /**
     * Parses an RFC 5322 date such as {@code Tue, 3 Jun 2008 11:05:30 +0200 (CEST)}.
     * @return the instant, or null when the value cannot be parsed
     */
    static Instant parseDate(String value) {
        String cleaned = value.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
        try {
            return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Date header '{}'", value);
            return null;
        }
    }

    /**
     * Depth-first search for the first text/plain part; other content types are ignored.
     */
    static String extractPlainText(MessagePart part) {
        if ("text/plain".equals(part.getMimeType()) && part.getBody() != null && part.getBody().getData() != null) {
            byte[] decoded = part.getBody().decodeData();
            return decoded != null ? new String(decoded, StandardCharsets.UTF_8) : "";
        }
        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                String text = extractPlainText(subPart);
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    static <T> ProviderResult<T> classify(HttpResponseException e, String operation) {
        int status = e.getStatusCode();
        String message = operation + " failed with HTTP " + status;
        if (status == 429 || (status == 403 && isRateLimitReason(e))) {
            return ProviderResult.failure(new ProviderError(ErrorKind.RATE_LIMITED, message, retryAfter(e.getHeaders())));
        }
        if (status == 401 || status == 403) {
            return ProviderResult.failure(ErrorKind.TOKEN_REVOKED, message);
        }
        if (status == 404) {
            return ProviderResult.notFound(message);
        }
        if (status >= 500) {
            return ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, message);
        }
        return ProviderResult.failure(ErrorKind.MALFORMED_REQUEST, message + ": " + e.getContent());
    }

    // Gmail reports per-user quota exhaustion as 403 with a rateLimitExceeded reason
    private static boolean isRateLimitReason(HttpResponseException e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors().stream()
            .anyMatch(info -> "rateLimitExceeded".equals(info.getReason()) || "userRateLimitExceeded".equals(info.getReason()));
    }

    private static Duration retryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirstHeaderStringValue("Retry-After") : null;
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static <T> ProviderResult<T> transientFailure(IOException e, String operation) {
        log.warn("Gmail {} failed: {}", operation, e.getMessage());
        return ProviderResult.failure(ErrorKind.TRANSIENT_NETWORK, operation + " failed: " + e.getMessage());
    }
}
