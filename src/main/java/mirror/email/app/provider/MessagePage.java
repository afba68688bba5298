package mirror.email.app.provider;

import lombok.Value;

import java.util.List;

/**
 * One page of message ids, in the order the provider returned them.
 */
@Value
public class MessagePage {
    List<String> ids;
    String nextPageToken;

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
