package mirror.email.app.service;

import lombok.Value;

/**
 * AI verdict on one message.
 */
@Value
public class Classification {
    public static final String UNCATEGORIZED = "Uncategorized";
    public static final String NEUTRAL = "Neutral";

    String category;
    int importance;
    String summary;
    String sentiment;

    public static Classification fallback() {
        return new Classification(UNCATEGORIZED, 0, "Could not analyze email", NEUTRAL);
    }
}
