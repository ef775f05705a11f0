package sbhackathon.koala.goldenPath.register;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.common.ErrorType;
import sbhackathon.koala.goldenPath.common.OnboardingError;
import sbhackathon.koala.goldenPath.common.StageResult;
import sbhackathon.koala.goldenPath.config.KubernetesConfig;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;
import sbhackathon.koala.goldenPath.infra.KubectlExecutor;
import sbhackathon.koala.goldenPath.provision.RepositoryRef;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DeploymentRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentRegistrar.class);

    public static final String APPLICATION_KIND = "application";
    public static final String CREATED_BY = "golden-path-onboarding";

    private final KubectlExecutor kubectlExecutor;
    private final KubernetesConfig kubernetesConfig;

    public DeploymentRegistrar(KubectlExecutor kubectlExecutor, KubernetesConfig kubernetesConfig) {
        this.kubectlExecutor = kubectlExecutor;
        this.kubernetesConfig = kubernetesConfig;
    }

    /**
     * Argo CD Application을 생성하여 설정 저장소를 클러스터와 연결합니다.
     * 적용 실패는 재시도하지 않고 REGISTRATION 실패로 반환합니다.
     */
    public StageResult<DeploymentDescriptor> register(AppIdentifier appIdentifier, RepositoryRef configRepository) {
        DeploymentDescriptor descriptor = buildDescriptor(appIdentifier, configRepository);
        logger.info("Argo CD Application 등록 시작 - 이름: {}, 저장소: {}",
                descriptor.getName(), descriptor.getRepositoryUrl());

        try {
            kubectlExecutor.applyYaml(buildApplicationYaml(descriptor));
            logger.info("Argo CD Application 등록 완료: {}", descriptor.getName());
            return StageResult.success(descriptor);
        } catch (RuntimeException e) {
            String errorMessage = String.format(
                    "Argo CD Application '%s' 등록 실패 (config repository %s)",
                    descriptor.getName(),
                    configRepository.getCloneUrl()
            );
            logger.error("{}: {}", errorMessage, e.getMessage());
            return StageResult.failure(OnboardingError.of(ErrorType.REGISTRATION, errorMessage, e));
        }
    }

    DeploymentDescriptor buildDescriptor(AppIdentifier appIdentifier, RepositoryRef configRepository) {
        KubernetesConfig.ArgoCd argocd = kubernetesConfig.getArgocd();

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("app", appIdentifier.value());
        labels.put("created-by", CREATED_BY);

        return DeploymentDescriptor.builder()
                .name(appIdentifier.value())
                .controllerNamespace(argocd.getNamespace())
                .project(argocd.getProject())
                .repositoryUrl(configRepository.getCloneUrl())
                .targetRevision(argocd.getTargetRevision())
                .path(argocd.getPath())
                .destinationServer(argocd.getDestinationServer())
                .destinationNamespace(kubernetesConfig.getNamespace())
                .labels(labels)
                .prune(true)
                .selfHeal(true)
                .syncOptions(List.of("CreateNamespace=true", "PrunePropagationPolicy=foreground", "PruneLast=true"))
                .retryLimit(5)
                .backoffDuration("5s")
                .backoffFactor(2)
                .backoffMaxDuration("3m")
                .build();
    }

    /**
     * Argo CD Application YAML을 생성합니다.
     */
    String buildApplicationYaml(DeploymentDescriptor descriptor) {
        StringBuilder yaml = new StringBuilder();

        yaml.append(String.format("""
                apiVersion: argoproj.io/v1alpha1
                kind: Application
                metadata:
                  name: %s
                  namespace: %s
                  labels:
                """, descriptor.getName(), descriptor.getControllerNamespace()));

        descriptor.getLabels().forEach((key, value) ->
                yaml.append(String.format("""
                            %s: %s
                        """, key, value)));

        yaml.append(String.format("""
                spec:
                  project: %s
                  source:
                    repoURL: %s
                    targetRevision: %s
                    path: %s
                  destination:
                    server: %s
                    namespace: %s
                  syncPolicy:
                    automated:
                      prune: %s
                      selfHeal: %s
                      allowEmpty: false
                    syncOptions:
                """,
                descriptor.getProject(),
                descriptor.getRepositoryUrl(),
                descriptor.getTargetRevision(),
                descriptor.getPath(),
                descriptor.getDestinationServer(),
                descriptor.getDestinationNamespace(),
                descriptor.isPrune(),
                descriptor.isSelfHeal()));

        for (String option : descriptor.getSyncOptions()) {
            yaml.append(String.format("""
                          - %s
                    """, option));
        }

        yaml.append(String.format("""
                    retry:
                      limit: %d
                      backoff:
                        duration: %s
                        factor: %d
                        maxDuration: %s
                  revisionHistoryLimit: 10
                  ignoreDifferences:
                    - group: apps
                      kind: Deployment
                      jsonPointers:
                        - /spec/replicas
                """,
                descriptor.getRetryLimit(),
                descriptor.getBackoffDuration(),
                descriptor.getBackoffFactor(),
                descriptor.getBackoffMaxDuration()));

        logger.debug("생성된 Application YAML:\n{}", yaml);
        return yaml.toString();
    }
}
