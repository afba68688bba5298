package mirror.email.app.provider;

import java.util.List;

/**
 * Remote mailbox operations needed by sync, send and flag push-back.
 * Implementations are stateless: the access token is passed on every call and no call is retried internally.
 */
public interface MailProviderClient {
    /**
     * List one page of message ids.
     * @param accessToken OAuth access token
     * @param pageToken cursor returned by the previous page, null for the first page
     * @param pageSize maximum ids to return
     * @param query provider search query, may be null
     * @return the page; an absent next-page token means the listing is exhausted
     */
    ProviderResult<MessagePage> listMessageIds(String accessToken, String pageToken, int pageSize, String query);

    /**
     * Fetch one message with headers and plain-text body.
     * Missing Subject/From headers are reported with their defaults, never as a failure.
     * @param accessToken OAuth access token
     * @param messageId provider message id
     * @return the message detail
     */
    ProviderResult<MessageDetail> fetchMessage(String accessToken, String messageId);

    /**
     * Send a plain-text message. The same (to, subject, body) always produces the same raw payload.
     * @param accessToken OAuth access token
     * @param to recipient address
     * @param subject subject line
     * @param body plain-text body
     * @return provider id and thread id of the sent message
     */
    ProviderResult<SentMessage> sendMessage(String accessToken, String to, String subject, String body);

    /**
     * Add and remove labels on a message.
     * @param accessToken OAuth access token
     * @param messageId provider message id
     * @param addLabelIds labels to add
     * @param removeLabelIds labels to remove
     */
    ProviderResult<Void> modifyLabels(String accessToken, String messageId, List<String> addLabelIds, List<String> removeLabelIds);

    /**
     * Move a message to the provider's trash.
     * @param accessToken OAuth access token
     * @param messageId provider message id
     */
    ProviderResult<Void> trashMessage(String accessToken, String messageId);
}
