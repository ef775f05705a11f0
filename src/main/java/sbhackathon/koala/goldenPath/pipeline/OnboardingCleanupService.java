package sbhackathon.koala.goldenPath.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.config.KubernetesConfig;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.dto.CleanupResponse;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;
import sbhackathon.koala.goldenPath.infra.KubectlExecutor;
import sbhackathon.koala.goldenPath.provision.GitHubApiException;
import sbhackathon.koala.goldenPath.provision.GitHubClient;
import sbhackathon.koala.goldenPath.register.DeploymentRegistrar;

/**
 * Removes everything an onboarding run may have created: the Argo CD Application first, then both
 * repositories. Resources that are already gone count as removed.
 *
 * <p>Only invoked on request, never by a failing run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnboardingCleanupService {

    private final KubectlExecutor kubectlExecutor;
    private final GitHubClient gitHubClient;
    private final KubernetesConfig kubernetesConfig;
    private final OnboardingProperties properties;

    public CleanupResponse cleanup(AppIdentifier appIdentifier) {
        log.info("Cleaning up onboarding artifacts for {}", appIdentifier);
        CleanupResponse.CleanupResponseBuilder response = CleanupResponse.builder().appName(appIdentifier.value());
        boolean success = true;

        String namespace = kubernetesConfig.getArgocd().getNamespace();
        try {
            String output = kubectlExecutor.deleteResource(DeploymentRegistrar.APPLICATION_KIND,
                    appIdentifier.value(), namespace);
            response.result("application " + namespace + "/" + appIdentifier + ": "
                    + (output.isEmpty() ? "not found" : "deleted"));
        } catch (RuntimeException e) {
            log.error("Failed to delete Application {}: {}", appIdentifier, e.getMessage());
            response.result("application " + namespace + "/" + appIdentifier + ": failed (" + e.getMessage() + ")");
            success = false;
        }

        String owner = properties.getGithub().getOwner();
        for (String repository : new String[]{appIdentifier.sourceRepositoryName(), appIdentifier.configRepositoryName()}) {
            try {
                boolean deleted = gitHubClient.deleteRepository(owner, repository);
                response.result("repository " + repository + ": " + (deleted ? "deleted" : "not found"));
            } catch (GitHubApiException e) {
                log.error("Failed to delete repository {}/{}: {}", owner, repository, e.getMessage());
                response.result("repository " + repository + ": failed (" + e.getMessage() + ")");
                success = false;
            }
        }

        return response.success(success).build();
    }
}
