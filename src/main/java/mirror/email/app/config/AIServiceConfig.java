package mirror.email.app.config;

import com.theokanning.openai.service.OpenAiService;
import mirror.email.app.service.AIService;
import mirror.email.app.service.EmailClassificationService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AIServiceConfig {

    @Bean
    public EmailClassificationService emailClassificationService(@Value("${openai.api.key:}") String apiKey,
                                                                 @Value("${openai.model:gpt-3.5-turbo}") String model) {
        return new AIService(new OpenAiService(apiKey, Duration.ofSeconds(30)), model);
    }
}
