package mirror.email.app.store;

/**
 * The backing store failed. The current operation is aborted; callers do not retry around it.
 */
public class RepositoryUnavailableException extends RuntimeException {
    public RepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
