package mirror.email.app.controller.dto;

import lombok.Data;

import java.util.List;

@Data
public class BulkActionRequest {
    private List<String> emailIds;
    /** archive, delete, mark-read, mark-unread, star or unstar */
    private String action;
}
