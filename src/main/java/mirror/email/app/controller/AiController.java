package mirror.email.app.controller;

import mirror.email.app.controller.dto.AiRequest;
import mirror.email.app.service.Classification;
import mirror.email.app.service.EmailClassificationService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/ai")
public class AiController {
    private final EmailClassificationService emailClassificationService;

    public AiController(EmailClassificationService emailClassificationService) {
        this.emailClassificationService = emailClassificationService;
    }

    @PostMapping("/classify")
    public Classification classify(@RequestBody AiRequest request) {
        return emailClassificationService.classify(requireContent(request));
    }

    @PostMapping("/reply")
    public Map<String, String> reply(@RequestBody AiRequest request) {
        return Map.of("reply", emailClassificationService.reply(requireContent(request), request.getTone()));
    }

    private static String requireContent(AiRequest request) {
        if (request == null || request.getContent() == null || request.getContent().isBlank()) {
            throw new IllegalArgumentException("content is required");
        }
        return request.getContent();
    }
}
