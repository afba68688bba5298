package mirror.email.app.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class MessageDetail {
    String id;
    String threadId;
    String subject;
    String from;
    String to;
    /** Parsed Date header; null when absent or unparseable. */
    Instant date;
    /** Provider receipt time; null when the provider did not send one. */
    Instant internalDate;
    String snippet;
    String body;
    @Singular
    List<String> labelIds;
}
