package sbhackathon.koala.goldenPath.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import sbhackathon.koala.goldenPath.OnboardingRunner;
import sbhackathon.koala.goldenPath.common.ErrorType;
import sbhackathon.koala.goldenPath.common.OnboardingError;
import sbhackathon.koala.goldenPath.dto.ApplicationStatusResponse;
import sbhackathon.koala.goldenPath.dto.CleanupResponse;
import sbhackathon.koala.goldenPath.dto.OnboardingRequest;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;
import sbhackathon.koala.goldenPath.extract.AppNameExtractor;
import sbhackathon.koala.goldenPath.extract.ModelAppNameExtractor;
import sbhackathon.koala.goldenPath.pipeline.OnboardingCleanupService;
import sbhackathon.koala.goldenPath.pipeline.OnboardingOrchestrator;
import sbhackathon.koala.goldenPath.pipeline.OnboardingReport;
import sbhackathon.koala.goldenPath.pipeline.OnboardingState;
import sbhackathon.koala.goldenPath.provision.GitHubClient;
import sbhackathon.koala.goldenPath.register.ApplicationStatusService;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class OnboardingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AppNameExtractor appNameExtractor;

    @Autowired
    private GitHubClient gitHubClient;

    @Autowired
    private OnboardingRunner onboardingRunner;

    @MockBean
    private OnboardingOrchestrator onboardingOrchestrator;
    @MockBean
    private ApplicationStatusService applicationStatusService;
    @MockBean
    private OnboardingCleanupService onboardingCleanupService;
    @MockBean
    private ChatModel chatModel;  // Spring AI Mock

    @Test
    void context_빈_구성() {
        // then
        assertThat(appNameExtractor).isInstanceOf(ModelAppNameExtractor.class);
        assertThat(gitHubClient).isNotNull();
        assertThat(onboardingRunner.getExitCode()).isZero();
        verifyNoInteractions(onboardingOrchestrator);
    }

    @Test
    void onboard_성공() throws Exception {
        // given
        when(onboardingOrchestrator.run("I need a new NodeJS service called inventory-api"))
                .thenReturn(OnboardingReport.builder()
                        .appName("inventory-api")
                        .state(OnboardingState.DONE)
                        .descriptorName("inventory-api")
                        .artifact("repository:inventory-api-source")
                        .build());

        // when & then
        mockMvc.perform(post("/api/onboarding")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new OnboardingRequest("I need a new NodeJS service called inventory-api"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.message").value("온보딩이 성공적으로 완료되었습니다."))
                .andExpect(jsonPath("$.report.appName").value("inventory-api"))
                .andExpect(jsonPath("$.report.state").value("DONE"))
                .andExpect(jsonPath("$.report.artifacts[0]").value("repository:inventory-api-source"));
    }

    @Test
    void onboard_요청문장_없음() throws Exception {
        // when & then
        mockMvc.perform(post("/api/onboarding")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("VALIDATION_ERROR"));

        verifyNoInteractions(onboardingOrchestrator);
    }

    @Test
    void onboard_사전조건_미충족() throws Exception {
        // given
        when(onboardingOrchestrator.run(anyString())).thenReturn(OnboardingReport.builder()
                .state(OnboardingState.FAILED)
                .failedStage(OnboardingState.START)
                .error(OnboardingError.of(ErrorType.PRECONDITION, "Preconditions not met: kubectl is not available"))
                .build());

        // when & then
        mockMvc.perform(post("/api/onboarding")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request\": \"\"}"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.status").value("PRECONDITION_FAILED"))
                .andExpect(jsonPath("$.report.error.type").value("PRECONDITION"));
    }

    @Test
    void onboard_단계_실패() throws Exception {
        // given
        when(onboardingOrchestrator.run(anyString())).thenReturn(OnboardingReport.builder()
                .appName("inventory-api")
                .state(OnboardingState.FAILED)
                .failedStage(OnboardingState.PROVISIONING)
                .error(new OnboardingError(ErrorType.PROVISION,
                        "Repository 'inventory-api-config' could not be provisioned", "403 Forbidden",
                        List.of("repository:inventory-api-source")))
                .artifacts(List.of("repository:inventory-api-source"))
                .build());

        // when & then
        mockMvc.perform(post("/api/onboarding")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request\": \"Deploy my inventory-api service\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.report.failedStage").value("PROVISIONING"))
                .andExpect(jsonPath("$.report.artifacts[0]").value("repository:inventory-api-source"));
    }

    @Test
    void status_조회() throws Exception {
        // given
        when(applicationStatusService.readStatus(new AppIdentifier("inventory-api")))
                .thenReturn(ApplicationStatusResponse.builder()
                        .appName("inventory-api")
                        .registered(true)
                        .syncStatus("Synced")
                        .healthStatus("Healthy")
                        .build());

        // when & then
        mockMvc.perform(get("/api/onboarding/inventory-api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syncStatus").value("Synced"))
                .andExpect(jsonPath("$.healthStatus").value("Healthy"));
    }

    @Test
    void status_미등록_404() throws Exception {
        // given
        when(applicationStatusService.readStatus(new AppIdentifier("inventory-api")))
                .thenReturn(ApplicationStatusResponse.builder()
                        .appName("inventory-api")
                        .registered(false)
                        .syncStatus(ApplicationStatusResponse.NOT_FOUND)
                        .healthStatus(ApplicationStatusResponse.NOT_FOUND)
                        .build());

        // when & then
        mockMvc.perform(get("/api/onboarding/inventory-api/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.syncStatus").value("NOT_FOUND"));
    }

    @Test
    void status_잘못된_이름() throws Exception {
        // when & then
        mockMvc.perform(get("/api/onboarding/Inventory_API/status"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(applicationStatusService);
    }

    @Test
    void cleanup_삭제() throws Exception {
        // given
        when(onboardingCleanupService.cleanup(new AppIdentifier("inventory-api")))
                .thenReturn(CleanupResponse.builder()
                        .appName("inventory-api")
                        .result("repository inventory-api-source: deleted")
                        .success(true)
                        .build());

        // when & then
        mockMvc.perform(delete("/api/onboarding/inventory-api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.results[0]").value("repository inventory-api-source: deleted"));
    }
}
