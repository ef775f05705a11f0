package sbhackathon.koala.goldenPath.provision;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.common.ErrorType;
import sbhackathon.koala.goldenPath.common.OnboardingError;
import sbhackathon.koala.goldenPath.common.StageResult;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;

import java.util.List;
import java.util.Optional;

/**
 * Makes sure the source and configuration repositories of an application exist.
 *
 * <p>Each repository is looked up first and reused when present, created otherwise. When creation
 * is rejected because the name is taken but the repository could not be read (for example a
 * repository of another account visible only by name), its clone URL is inferred from the owner
 * and name without further verification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryProvisioner {

    private final GitHubClient gitHubClient;
    private final OnboardingProperties properties;

    public StageResult<RepositoryPair> provision(AppIdentifier appIdentifier) {
        log.info("Creating GitHub repositories for {}", appIdentifier);

        RepositoryRef source;
        try {
            source = resolve(appIdentifier.sourceRepositoryName(), "Source code for " + appIdentifier);
        } catch (GitHubApiException e) {
            log.error("Source repository {} could not be provisioned: {}",
                    appIdentifier.sourceRepositoryName(), e.getMessage());
            return StageResult.failure(new OnboardingError(ErrorType.PROVISION,
                    String.format("Repository '%s' could not be provisioned for '%s'; repository '%s' was not attempted",
                            appIdentifier.sourceRepositoryName(), appIdentifier, appIdentifier.configRepositoryName()),
                    e.getMessage(), List.of()));
        }

        RepositoryRef config;
        try {
            config = resolve(appIdentifier.configRepositoryName(), "GitOps configuration for " + appIdentifier);
        } catch (GitHubApiException e) {
            log.error("Config repository {} could not be provisioned: {}",
                    appIdentifier.configRepositoryName(), e.getMessage());
            return StageResult.failure(new OnboardingError(ErrorType.PROVISION,
                    String.format("Repository '%s' could not be provisioned for '%s'; repository '%s' was provisioned at %s",
                            appIdentifier.configRepositoryName(), appIdentifier, source.getName(), source.getCloneUrl()),
                    e.getMessage(), List.of("repository:" + source.getName())));
        }

        log.info("Repositories ready: {}, {}", source.getCloneUrl(), config.getCloneUrl());
        return StageResult.success(RepositoryPair.builder().source(source).config(config).build());
    }

    private RepositoryRef resolve(String name, String description) {
        String owner = properties.getGithub().getOwner();

        Optional<GitHubRepositoryDto> existing = Optional.empty();
        try {
            existing = gitHubClient.findRepository(owner, name);
        } catch (GitHubApiException e) {
            log.warn("Existence check for {}/{} failed, attempting creation: {}", owner, name, e.getMessage());
        }

        if (existing.isPresent()) {
            log.info("Using existing repo: {}", existing.get().getHtmlUrl());
            return toRef(existing.get(), true);
        }

        try {
            GitHubRepositoryDto created = gitHubClient.createRepository(name, description);
            log.info("Created repo: {}", created.getHtmlUrl());
            return toRef(created, false);
        } catch (GitHubApiException e) {
            if (!e.isAlreadyExists()) {
                throw e;
            }
            RepositoryRef inferred = inferredRef(owner, name);
            log.warn("Repository {}/{} already exists but could not be read, assuming {}",
                    owner, name, inferred.getCloneUrl());
            return inferred;
        }
    }

    private RepositoryRef toRef(GitHubRepositoryDto repository, boolean existedBefore) {
        String defaultBranch = repository.getDefaultBranch() != null
                ? repository.getDefaultBranch()
                : properties.getGit().getDefaultBranch();
        return RepositoryRef.builder()
                .name(repository.getName())
                .cloneUrl(repository.getCloneUrl())
                .webUrl(repository.getHtmlUrl())
                .defaultBranch(defaultBranch)
                .existedBefore(existedBefore)
                .inferred(false)
                .build();
    }

    private RepositoryRef inferredRef(String owner, String name) {
        String webUrl = stripTrailingSlash(properties.getGithub().getWebUrl()) + "/" + owner + "/" + name;
        return RepositoryRef.builder()
                .name(name)
                .cloneUrl(webUrl + ".git")
                .webUrl(webUrl)
                .defaultBranch(properties.getGit().getDefaultBranch())
                .existedBefore(true)
                .inferred(true)
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
