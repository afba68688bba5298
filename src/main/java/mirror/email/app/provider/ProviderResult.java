package mirror.email.app.provider;

import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single provider call: a value, a missing resource, or a retryable / fatal failure.
 * Callers branch on the status instead of catching exceptions, so a missing message is never
 * mistaken for a network blip.
 *
 * @param <T> the payload type on success
 */
@EqualsAndHashCode
public final class ProviderResult<T> {

    public enum Status {
        OK,
        NOT_FOUND,
        RETRYABLE,
        FATAL
    }

    private final Status status;
    private final T value;
    private final ProviderError error;

    private ProviderResult(Status status, T value, ProviderError error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> ProviderResult<T> ok(T value) {
        return new ProviderResult<>(Status.OK, value, null);
    }

    public static ProviderResult<Void> ok() {
        return new ProviderResult<>(Status.OK, null, null);
    }

    public static <T> ProviderResult<T> notFound(String message) {
        return new ProviderResult<>(Status.NOT_FOUND, null, ProviderError.of(ErrorKind.NOT_FOUND, message));
    }

    /**
     * Wraps an error, deriving the status from its kind.
     */
    public static <T> ProviderResult<T> failure(ProviderError error) {
        Objects.requireNonNull(error, "error");
        if (error.getKind() == ErrorKind.NOT_FOUND) {
            return new ProviderResult<>(Status.NOT_FOUND, null, error);
        }
        return new ProviderResult<>(error.isRetryable() ? Status.RETRYABLE : Status.FATAL, null, error);
    }

    public static <T> ProviderResult<T> failure(ErrorKind kind, String message) {
        return failure(ProviderError.of(kind, message));
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The payload; only meaningful when {@link #isOk()}.
     */
    public T getValue() {
        if (status != Status.OK) {
            throw new IllegalStateException("No value on a " + status + " result: " + error.getMessage());
        }
        return value;
    }

    /**
     * The failure, or null on success.
     */
    public ProviderError getError() {
        return error;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE;
    }

    public boolean isFatal() {
        return status == Status.FATAL;
    }

    public <U> ProviderResult<U> map(Function<T, U> mapper) {
        if (status == Status.OK) {
            return ProviderResult.ok(mapper.apply(value));
        }
        return new ProviderResult<>(status, null, error);
    }

    @Override
    public String toString() {
        if (status == Status.OK) {
            return "ProviderResult.ok(" + value + ")";
        }
        return "ProviderResult." + status + "(" + error.getKind() + ": " + error.getMessage() + ")";
    }
}
