package mirror.email.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * OpenAI chat-completion backed {@link EmailClassificationService}. Created by {@code AIServiceConfig}.
 */
@Slf4j
public class AIService implements EmailClassificationService {
    static final int MAX_CONTENT_LENGTH = 2000;

    private static final String CLASSIFY_SYSTEM_PROMPT = "You are an AI email assistant. Respond only in valid JSON.";
    private static final String CLASSIFY_PROMPT = """
        Analyze the following email and provide a JSON response with these fields:
        - category: One of [Important, Client, Lead, Payment, Low Priority, Spam]
        - importance: Integer 0-100
        - summary: Brief 1-sentence summary
        - sentiment: One of [Positive, Neutral, Negative]

        Email Content:
        %s
        """;
    private static final String REPLY_PROMPT = """
        Draft a %s reply to the following email.
        Keep it concise and relevant.

        Email Content:
        %s
        """;

    private final OpenAiService openAiService;
    private final String model;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public AIService(OpenAiService openAiService, String model) {
        this.openAiService = openAiService;
        this.model = model;
    }

    @Override
    public Classification classify(String emailContent) {
        String answer = complete("email classification", List.of(
            new ChatMessage("system", CLASSIFY_SYSTEM_PROMPT),
            new ChatMessage("user", String.format(CLASSIFY_PROMPT, truncate(emailContent)))), 300, 0.3);
        return parseClassification(answer);
    }

    @Override
    public String reply(String emailContent, String tone) {
        String effectiveTone = tone == null || tone.isBlank() ? "professional" : tone;
        return complete("reply generation", List.of(
            new ChatMessage("system", "You are a helpful email assistant."),
            new ChatMessage("user", String.format(REPLY_PROMPT, effectiveTone, truncate(emailContent)))), 500, 0.7);
    }

    Classification parseClassification(String answer) {
        if (answer == null) {
            return Classification.fallback();
        }
        // Models sometimes wrap JSON in a markdown fence
        String json = answer.replaceAll("^```(?:json)?\\s*", "").replaceAll("\\s*```$", "").trim();
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return Classification.fallback();
            }
            int importance = Math.max(0, Math.min(100, node.path("importance").asInt(0)));
            return new Classification(
                node.path("category").asText(Classification.UNCATEGORIZED),
                importance,
                node.path("summary").asText(""),
                node.path("sentiment").asText(Classification.NEUTRAL));
        } catch (JsonProcessingException e) {
            log.warn("Classification answer was not valid JSON: {}", e.getOriginalMessage());
            return Classification.fallback();
        }
    }

    private String complete(String operation, List<ChatMessage> messages, int maxTokens, double temperature) {
        ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model(model)
            .messages(messages)
            .maxTokens(maxTokens)
            .temperature(temperature)
            .build();
        try {
            return openAiService.createChatCompletion(request)
                .getChoices().get(0).getMessage().getContent().trim();
        } catch (RuntimeException e) {
            throw translate(e, operation);
        }
    }

    private RuntimeException translate(RuntimeException e, String operation) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        boolean quota = (e instanceof OpenAiHttpException && ((OpenAiHttpException) e).statusCode == 429)
            || errorMessage.contains("quota")
            || errorMessage.contains("rate limit");
        if (quota) {
            return new QuotaException("OpenAI quota/rate limit exceeded during " + operation + ": " + e.getMessage(), e);
        }
        return e;
    }

    static String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= MAX_CONTENT_LENGTH) {
            return content;
        }
        int end = Character.isHighSurrogate(content.charAt(MAX_CONTENT_LENGTH - 1)) ? MAX_CONTENT_LENGTH - 1 : MAX_CONTENT_LENGTH;
        return content.substring(0, end) + "...";
    }
}
