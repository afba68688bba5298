package mirror.email.app.controller.dto;

import lombok.Data;

@Data
public class SnoozeRequest {
    /** ISO-8601 instant, e.g. 2024-06-01T08:00:00Z */
    private String until;
}
