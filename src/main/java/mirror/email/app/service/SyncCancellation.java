package mirror.email.app.service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a sync run: an explicit flag plus an optional deadline.
 * The run checks it between pages and between message fetches.
 */
public class SyncCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Instant deadline;

    private SyncCancellation(Instant deadline) {
        this.deadline = deadline;
    }

    public static SyncCancellation none() {
        return new SyncCancellation(null);
    }

    public static SyncCancellation until(Instant deadline) {
        return new SyncCancellation(deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled(Instant now) {
        return cancelled.get() || (deadline != null && !now.isBefore(deadline));
    }
}
