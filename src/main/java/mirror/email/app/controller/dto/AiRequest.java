package mirror.email.app.controller.dto;

import lombok.Data;

@Data
public class AiRequest {
    private String content;
    private String tone;
}
