package sbhackathon.koala.goldenPath.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CustomObjectsApi;
import io.kubernetes.client.util.Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Slf4j
@Configuration
public class KubernetesClientConfig {

    @Bean
    public ApiClient kubernetesApiClient() throws IOException {
        // kubeconfig -> in-cluster service account -> localhost:8080 순서로 찾는다
        ApiClient client = Config.defaultClient();
        log.info("Kubernetes Java Client 설정 완료: {}", client.getBasePath());
        return client;
    }

    @Bean
    public CustomObjectsApi customObjectsApi(ApiClient kubernetesApiClient) {
        return new CustomObjectsApi(kubernetesApiClient);
    }
}
