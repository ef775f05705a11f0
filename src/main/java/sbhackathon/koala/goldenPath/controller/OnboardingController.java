package sbhackathon.koala.goldenPath.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sbhackathon.koala.goldenPath.dto.ApplicationStatusResponse;
import sbhackathon.koala.goldenPath.dto.CleanupResponse;
import sbhackathon.koala.goldenPath.dto.OnboardingRequest;
import sbhackathon.koala.goldenPath.dto.OnboardingResponse;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;
import sbhackathon.koala.goldenPath.pipeline.OnboardingCleanupService;
import sbhackathon.koala.goldenPath.pipeline.OnboardingOrchestrator;
import sbhackathon.koala.goldenPath.pipeline.OnboardingReport;
import sbhackathon.koala.goldenPath.register.ApplicationStatusService;

@RestController
@RequestMapping("/api/onboarding")
public class OnboardingController {

    private static final Logger logger = LoggerFactory.getLogger(OnboardingController.class);

    private final OnboardingOrchestrator onboardingOrchestrator;
    private final ApplicationStatusService applicationStatusService;
    private final OnboardingCleanupService onboardingCleanupService;

    public OnboardingController(OnboardingOrchestrator onboardingOrchestrator,
                                ApplicationStatusService applicationStatusService,
                                OnboardingCleanupService onboardingCleanupService) {
        this.onboardingOrchestrator = onboardingOrchestrator;
        this.applicationStatusService = applicationStatusService;
        this.onboardingCleanupService = onboardingCleanupService;
    }

    /**
     * 자연어 요청으로 애플리케이션을 온보딩합니다.
     *
     * @param request 온보딩 요청 (예: "I need a new NodeJS service called inventory-api")
     * @return 단계별 결과 보고서
     */
    @PostMapping
    public ResponseEntity<OnboardingResponse> onboard(@RequestBody(required = false) OnboardingRequest request) {
        if (request == null || request.getRequest() == null) {
            logger.error("온보딩 요청 검증 실패: request 필드 누락");
            return ResponseEntity.badRequest().body(new OnboardingResponse(
                    "온보딩 요청이 올바르지 않습니다: 요청 문장(request)은 필수입니다.",
                    "VALIDATION_ERROR",
                    null
            ));
        }

        logger.info("온보딩 요청 수신: {}", request.getRequest());
        OnboardingReport report = onboardingOrchestrator.run(request.getRequest());

        if (report.isSuccess()) {
            logger.info("온보딩 성공 - 앱: {}", report.getAppName());
            return ResponseEntity.ok(new OnboardingResponse(
                    "온보딩이 성공적으로 완료되었습니다.",
                    "SUCCESS",
                    report
            ));
        }

        if (report.isPreconditionFailure()) {
            logger.warn("온보딩 사전 조건 미충족: {}", report.getError().message());
            return ResponseEntity.status(HttpStatus.PRECONDITION_FAILED).body(new OnboardingResponse(
                    "온보딩 사전 조건이 충족되지 않았습니다: " + report.getError().message(),
                    "PRECONDITION_FAILED",
                    report
            ));
        }

        logger.error("온보딩 실패 - 단계: {}, 앱: {}", report.getFailedStage(), report.getAppName());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new OnboardingResponse(
                "온보딩 중 오류가 발생했습니다: " + report.getError().message(),
                "ERROR",
                report
        ));
    }

    /**
     * Argo CD Application의 동기화/헬스 상태를 조회합니다.
     */
    @GetMapping("/{appName}/status")
    public ResponseEntity<ApplicationStatusResponse> status(@PathVariable String appName) {
        AppIdentifier appIdentifier;
        try {
            appIdentifier = new AppIdentifier(appName);
        } catch (IllegalArgumentException e) {
            logger.error("잘못된 애플리케이션 이름: {}", appName);
            return ResponseEntity.badRequest().build();
        }

        try {
            ApplicationStatusResponse response = applicationStatusService.readStatus(appIdentifier);
            if (!response.isRegistered()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("상태 조회 중 오류 발생 - 앱: {}", appName, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * 온보딩으로 생성된 Application과 저장소를 삭제합니다.
     */
    @DeleteMapping("/{appName}")
    public ResponseEntity<CleanupResponse> cleanup(@PathVariable String appName) {
        AppIdentifier appIdentifier;
        try {
            appIdentifier = new AppIdentifier(appName);
        } catch (IllegalArgumentException e) {
            logger.error("잘못된 애플리케이션 이름: {}", appName);
            return ResponseEntity.badRequest().build();
        }

        logger.info("정리 요청 수신 - 앱: {}", appIdentifier);
        CleanupResponse response = onboardingCleanupService.cleanup(appIdentifier);
        if (!response.isSuccess()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
