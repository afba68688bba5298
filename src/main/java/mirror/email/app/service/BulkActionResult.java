package mirror.email.app.service;

import lombok.Value;

@Value
public class BulkActionResult {
    int requested;
    int succeeded;
    int failed;
}
