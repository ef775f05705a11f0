package sbhackathon.koala.goldenPath.extract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelAppNameExtractorTest {

    @Mock
    private ChatModel chatModel;

    private OnboardingProperties properties;
    private ModelAppNameExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new OnboardingProperties();
        properties.getModel().setApiKey("test-key");
        extractor = new ModelAppNameExtractor(chatModel, new PatternAppNameExtractor(properties), properties);
    }

    @Test
    void modelAnswerIsNormalized() {
        when(chatModel.call(any(Prompt.class))).thenReturn(answer(" \"Inventory-API\"\n"));

        AppIdentifier identifier = extractor.extract("I need a new NodeJS service called inventory-api");

        assertThat(identifier).isEqualTo(new AppIdentifier("inventory-api"));
    }

    @Test
    void promptCarriesRequestAndBoundedOptions() {
        when(chatModel.call(any(Prompt.class))).thenReturn(answer("user-management"));

        extractor.extract("Deploy my user-management service");

        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertThat(prompt.getValue().getContents()).contains("\"Deploy my user-management service\"");
        assertThat(prompt.getValue().getOptions().getTemperature()).isEqualTo(0.1);
        assertThat(prompt.getValue().getOptions().getMaxTokens()).isEqualTo(50);
    }

    @Test
    void modelFailureFallsBackToPatterns() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("401 Unauthorized"));

        AppIdentifier identifier = extractor.extract("Create a payment-processor app");

        assertThat(identifier).isEqualTo(new AppIdentifier("payment-processor"));
    }

    @Test
    void unusableAnswerFallsBackToPatterns() {
        when(chatModel.call(any(Prompt.class))).thenReturn(answer("???"));

        AppIdentifier identifier = extractor.extract("a worker named billing-sync");

        assertThat(identifier).isEqualTo(new AppIdentifier("billing-sync"));
    }

    @Test
    void disabledModelIsNeverCalled() {
        properties.getModel().setEnabled(false);

        AppIdentifier identifier = extractor.extract("I need a new NodeJS service called inventory-api");

        assertThat(identifier).isEqualTo(new AppIdentifier("inventory-api"));
        verifyNoInteractions(chatModel);
    }

    @Test
    void emptyRequestSkipsModelAndUsesDefault() {
        AppIdentifier identifier = extractor.extract("");

        assertThat(identifier).isEqualTo(new AppIdentifier("my-app"));
        verifyNoInteractions(chatModel);
    }

    private static ChatResponse answer(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
