package mirror.email.app.provider;

import lombok.Value;

@Value
public class SentMessage {
    String providerId;
    String threadId;
}
