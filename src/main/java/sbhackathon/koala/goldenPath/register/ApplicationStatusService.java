package sbhackathon.koala.goldenPath.register;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CustomObjectsApi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.config.KubernetesConfig;
import sbhackathon.koala.goldenPath.dto.ApplicationStatusResponse;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;

import java.util.Map;

/**
 * Reads the live Argo CD Application registered for an onboarded app.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationStatusService {

    static final String GROUP = "argoproj.io";
    static final String VERSION = "v1alpha1";
    static final String PLURAL = "applications";

    private final CustomObjectsApi customObjectsApi;
    private final KubernetesConfig kubernetesConfig;

    public ApplicationStatusResponse readStatus(AppIdentifier appIdentifier) {
        String namespace = kubernetesConfig.getArgocd().getNamespace();
        try {
            Object application = customObjectsApi
                    .getNamespacedCustomObject(GROUP, VERSION, namespace, PLURAL, appIdentifier.value())
                    .execute();

            String sync = path(application, "status", "sync", "status");
            String health = path(application, "status", "health", "status");
            log.info("Application {} 상태 - sync: {}, health: {}", appIdentifier, sync, health);

            return ApplicationStatusResponse.builder()
                    .appName(appIdentifier.value())
                    .registered(true)
                    .syncStatus(sync != null ? sync : ApplicationStatusResponse.UNKNOWN)
                    .healthStatus(health != null ? health : ApplicationStatusResponse.UNKNOWN)
                    .revision(path(application, "status", "sync", "revision"))
                    .repositoryUrl(path(application, "spec", "source", "repoURL"))
                    .build();

        } catch (ApiException e) {
            if (e.getCode() == 404) {
                log.info("Application {} 이(가) {} 네임스페이스에 없습니다", appIdentifier, namespace);
                return ApplicationStatusResponse.builder()
                        .appName(appIdentifier.value())
                        .registered(false)
                        .syncStatus(ApplicationStatusResponse.NOT_FOUND)
                        .healthStatus(ApplicationStatusResponse.NOT_FOUND)
                        .message("Application not registered")
                        .build();
            }
            log.warn("Application {} 조회 실패: {} {}", appIdentifier, e.getCode(), e.getMessage());
            throw new IllegalStateException("Failed to read Application " + appIdentifier
                    + " (status " + e.getCode() + ")", e);
        }
    }

    private static String path(Object node, String... keys) {
        Object current = node;
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current != null ? current.toString() : null;
    }
}
