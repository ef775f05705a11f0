package sbhackathon.koala.goldenPath.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.infra.KubectlExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks credentials, template roots and cluster access before a run touches anything.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PreconditionValidator {

    private final OnboardingProperties properties;
    private final KubectlExecutor kubectlExecutor;

    /**
     * @return one message per unmet precondition, empty when the run may start
     */
    public List<String> findProblems() {
        List<String> problems = new ArrayList<>();

        if (isBlank(properties.getGithub().getToken())) {
            problems.add("GitHub token is not configured (GITHUB_TOKEN)");
        }
        if (isBlank(properties.getGithub().getOwner())) {
            problems.add("GitHub owner is not configured (GITHUB_USERNAME)");
        }
        if (properties.getModel().isEnabled() && isBlank(properties.getModel().getApiKey())) {
            problems.add("Model API key is not configured (OPENROUTER_API_KEY)");
        }
        checkTemplateRoot("Source template", properties.getTemplates().getSourcePath(), problems);
        checkTemplateRoot("Config template", properties.getTemplates().getConfigPath(), problems);
        if (!kubectlExecutor.isKubectlAvailable()) {
            problems.add("kubectl is not available");
        } else if (!kubectlExecutor.hasClusterContext()) {
            problems.add("Cluster access is not configured (no kubeconfig context and not running in-cluster)");
        }

        problems.forEach(problem -> log.warn("Precondition not met: {}", problem));
        return problems;
    }

    private static void checkTemplateRoot(String label, String path, List<String> problems) {
        if (isBlank(path)) {
            problems.add(label + " path is not configured");
        } else if (!Files.isDirectory(Path.of(path))) {
            problems.add(label + " directory not found: " + path);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
