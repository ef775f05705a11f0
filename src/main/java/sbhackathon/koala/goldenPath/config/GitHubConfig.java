package sbhackathon.koala.goldenPath.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class GitHubConfig {

    private static final String GITHUB_MEDIA_TYPE = "application/vnd.github+json";
    private static final String GITHUB_API_VERSION = "2022-11-28";

    @Bean
    public RestClient gitHubRestClient(RestClient.Builder builder, OnboardingProperties properties) {
        OnboardingProperties.GitHub github = properties.getGithub();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(github.getConnectTimeout());
        requestFactory.setReadTimeout(github.getReadTimeout());

        // 토큰이 비어 있으면 Authorization 헤더 없이 만들고, 실행 전에 PreconditionValidator가 막는다
        RestClient.Builder configured = builder
                .baseUrl(github.getApiUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_MEDIA_TYPE)
                .defaultHeader("X-GitHub-Api-Version", GITHUB_API_VERSION);
        if (github.getToken() != null && !github.getToken().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + github.getToken());
        }
        return configured.build();
    }
}
