package mirror.email.app.controller;

import lombok.extern.slf4j.Slf4j;
import mirror.email.app.service.EmailClassificationService;
import mirror.email.app.store.RepositoryUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ResponseStatus(HttpStatus.BAD_REQUEST)
    @ExceptionHandler(IllegalArgumentException.class)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return error("bad_request", ex.getMessage());
    }

    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    @ExceptionHandler(RepositoryUnavailableException.class)
    public Map<String, Object> handleRepositoryUnavailable(RepositoryUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage(), ex);
        return error("storage_unavailable", ex.getMessage());
    }

    @ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
    @ExceptionHandler(EmailClassificationService.QuotaException.class)
    public Map<String, Object> handleQuota(EmailClassificationService.QuotaException ex) {
        log.warn("AI quota exhausted: {}", ex.getMessage());
        return error("ai_quota_exceeded", ex.getMessage());
    }

    static Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message == null ? "unexpected error" : message);
        return body;
    }
}
