package sbhackathon.koala.goldenPath.provision;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thin wrapper over the GitHub REST API repository endpoints.
 */
@Slf4j
@Component
public class GitHubClient {

    private final RestClient restClient;
    private final OnboardingProperties properties;

    public GitHubClient(@Qualifier("gitHubRestClient") RestClient restClient, OnboardingProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * @return the repository, or empty when GitHub answers 404
     * @throws GitHubApiException for any other error response or a transport failure
     */
    public Optional<GitHubRepositoryDto> findRepository(String owner, String name) {
        try {
            GitHubRepositoryDto repository = restClient.get()
                    .uri("/repos/{owner}/{repo}", owner, name)
                    .retrieve()
                    .body(GitHubRepositoryDto.class);
            return Optional.ofNullable(repository);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientResponseException e) {
            throw toException("read " + owner + "/" + name, e);
        } catch (RestClientException e) {
            throw new GitHubApiException(0, "GitHub request failed (read " + owner + "/" + name + "): "
                    + e.getMessage(), null, e);
        }
    }

    /**
     * Creates a repository with an initial commit on its default branch, under the configured
     * organization or under the token's user.
     */
    public GitHubRepositoryDto createRepository(String name, String description) {
        OnboardingProperties.GitHub github = properties.getGithub();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("description", description);
        body.put("private", github.isPrivateRepositories());
        body.put("auto_init", true);

        try {
            RestClient.RequestBodyUriSpec post = restClient.post();
            RestClient.RequestBodySpec request = github.isOrganization()
                    ? post.uri("/orgs/{org}/repos", github.getOwner())
                    : post.uri("/user/repos");
            GitHubRepositoryDto created = request
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(GitHubRepositoryDto.class);
            if (created == null) {
                throw new GitHubApiException(0, "GitHub returned an empty body creating " + name, null, null);
            }
            return created;
        } catch (RestClientResponseException e) {
            throw toException("create " + name, e);
        } catch (RestClientException e) {
            throw new GitHubApiException(0, "GitHub request failed (create " + name + "): " + e.getMessage(), null, e);
        }
    }

    /**
     * @return false when the repository did not exist
     */
    public boolean deleteRepository(String owner, String name) {
        try {
            restClient.delete()
                    .uri("/repos/{owner}/{repo}", owner, name)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Deleted GitHub repository {}/{}", owner, name);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientResponseException e) {
            throw toException("delete " + owner + "/" + name, e);
        } catch (RestClientException e) {
            throw new GitHubApiException(0, "GitHub request failed (delete " + owner + "/" + name + "): "
                    + e.getMessage(), null, e);
        }
    }

    private GitHubApiException toException(String action, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        log.error("GitHub API error ({}): {} {}", action, status, body);
        return new GitHubApiException(status, "GitHub API error (" + action + "): " + status + " " + e.getStatusText(),
                body, e);
    }
}
