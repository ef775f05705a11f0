package sbhackathon.koala.goldenPath.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;

import java.util.Optional;

/**
 * Asks a hosted language model for the application name and falls back to
 * {@link PatternAppNameExtractor} when the model is disabled, fails or answers nothing usable.
 */
@Slf4j
@Primary
@Service
public class ModelAppNameExtractor implements AppNameExtractor {

    private static final String PROMPT_TEMPLATE = """
            Extract the application name from this developer request: "%s"

            Return only the application name in lowercase with hyphens, no other text.
            Examples:
            - "I need a new NodeJS service called inventory-api" -> "inventory-api"
            - "Deploy my user-management service" -> "user-management"
            - "Create a payment-processor app" -> "payment-processor"
            """;

    private final ChatModel chatModel;
    private final PatternAppNameExtractor fallback;
    private final OnboardingProperties properties;

    public ModelAppNameExtractor(ChatModel chatModel,
                                 PatternAppNameExtractor fallback,
                                 OnboardingProperties properties) {
        this.chatModel = chatModel;
        this.fallback = fallback;
        this.properties = properties;
    }

    @Override
    public AppIdentifier extract(String request) {
        String text = request == null ? "" : request;

        // an empty request gives the model nothing to extract, it would only invent a name
        if (properties.getModel().isEnabled() && !text.isBlank()) {
            Optional<AppIdentifier> suggested = askModel(text);
            if (suggested.isPresent()) {
                log.info("Model extracted application name '{}'", suggested.get());
                return suggested.get();
            }
        }

        log.warn("Using fallback extraction logic");
        return fallback.extract(text);
    }

    private Optional<AppIdentifier> askModel(String request) {
        OnboardingProperties.Model model = properties.getModel();
        ChatOptions options = ChatOptions.builder()
                .model(model.getName())
                .maxTokens(model.getMaxTokens())
                .temperature(model.getTemperature())
                .build();

        try {
            ChatResponse response = chatModel.call(new Prompt(PROMPT_TEMPLATE.formatted(request), options));
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                log.warn("Model returned no answer");
                return Optional.empty();
            }
            String answer = response.getResult().getOutput().getText();
            Optional<AppIdentifier> identifier = AppIdentifier.normalize(answer);
            if (identifier.isEmpty()) {
                log.warn("Model answer '{}' does not contain a usable name", answer);
            }
            return identifier;
        } catch (Exception e) {
            log.warn("AI extraction failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
