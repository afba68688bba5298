package mirror.email.app.service;

/**
 * AI enrichment of mailbox content. Kept behind an interface so sync and controllers can be tested without a model.
 */
public interface EmailClassificationService {
    /**
     * Raised when the AI provider refuses work because of quota or rate limits.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Classify a message into one of Important, Client, Lead, Payment, Low Priority or Spam,
     * with an importance score 0-100, a one-sentence summary and a sentiment.
     * @param emailContent message text; only the first 2000 characters are sent
     * @return the classification, or {@link Classification#fallback()} when the answer cannot be parsed
     * @throws QuotaException if AI service quota is exceeded
     */
    Classification classify(String emailContent);

    /**
     * Draft a reply to a message.
     * @param emailContent message text; only the first 2000 characters are sent
     * @param tone e.g. "professional" or "friendly"
     * @throws QuotaException if AI service quota is exceeded
     */
    String reply(String emailContent, String tone);
}
