package mirror.email.app.service;

import lombok.Value;

import java.util.List;

/**
 * Summary of one sync run. {@code fetched} counts detail fetches, {@code ingested} counts persisted messages.
 */
@Value
public class SyncReport {

    public enum Outcome {
        COMPLETED,
        NEEDS_REAUTH,
        ABORTED,
        CANCELLED
    }

    Outcome outcome;
    int fetched;
    int ingested;
    List<SyncError> errors;

    public static SyncReport needsReauth() {
        return new SyncReport(Outcome.NEEDS_REAUTH, 0, 0, List.of());
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }
}
