package sbhackathon.koala.goldenPath;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import sbhackathon.koala.goldenPath.pipeline.OnboardingOrchestrator;
import sbhackathon.koala.goldenPath.pipeline.OnboardingReport;

import java.util.List;

/**
 * Runs a single onboarding when the request is passed as command line arguments.
 *
 * <p>Exit codes: 0 when the run completed, 2 when a precondition was not met, 1 for any other
 * failure.
 */
@Component
public class OnboardingRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OnboardingRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PRECONDITION = 2;

    private final OnboardingOrchestrator onboardingOrchestrator;
    private int exitCode = EXIT_OK;

    public OnboardingRunner(OnboardingOrchestrator onboardingOrchestrator) {
        this.onboardingOrchestrator = onboardingOrchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            return;
        }

        String request = String.join(" ", words);
        log.info("Onboarding request: {}", request);
        OnboardingReport report = onboardingOrchestrator.run(request);
        exitCode = exitCodeOf(report);

        if (report.isSuccess()) {
            log.info("Onboarding of {} complete", report.getAppName());
            log.info("  Source repository: {}", report.getSourceRepository().getWebUrl());
            log.info("  Config repository: {}", report.getConfigRepository().getWebUrl());
            log.info("  Argo CD Application: {}", report.getDescriptorName());
        } else {
            log.error("Onboarding failed in stage {}: {}", report.getFailedStage(), report.getError().message());
            if (!report.getArtifacts().isEmpty()) {
                log.error("  Created before the failure: {}", String.join(", ", report.getArtifacts()));
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeOf(OnboardingReport report) {
        if (report.isSuccess()) {
            return EXIT_OK;
        }
        return report.isPreconditionFailure() ? EXIT_PRECONDITION : EXIT_FAILED;
    }
}
