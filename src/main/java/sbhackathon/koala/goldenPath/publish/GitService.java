package sbhackathon.koala.goldenPath.publish;

import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.RefUpdate;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.provision.RepositoryRef;
import sbhackathon.koala.goldenPath.template.RenderException;
import sbhackathon.koala.goldenPath.template.RenderedTree;
import sbhackathon.koala.goldenPath.template.TemplateRenderer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Clones a repository into a throw-away working copy, writes a rendered tree into it, commits and
 * pushes the default branch.
 */
@Slf4j
@Service
public class GitService {

    private final TemplateRenderer templateRenderer;
    private final OnboardingProperties properties;

    public GitService(TemplateRenderer templateRenderer, OnboardingProperties properties) {
        this.templateRenderer = templateRenderer;
        this.properties = properties;
    }

    public PublishResultDto publish(RepositoryRef repository, RenderedTree tree, String commitMessage) {
        Path workDir = Paths.get(properties.getWorkspacePath(),
                repository.getName() + "-" + System.currentTimeMillis());
        try {
            Files.createDirectories(workDir.getParent());

            log.info("Cloning {} to {}", repository.getCloneUrl(), workDir);
            try (Git git = Git.cloneRepository()
                    .setURI(repository.getCloneUrl())
                    .setDirectory(workDir.toFile())
                    .setCredentialsProvider(credentialsProvider())
                    .setTimeout(properties.getGit().getTimeoutSeconds())
                    .call()) {

                String branch = checkoutBranch(git, repository.getDefaultBranch());

                templateRenderer.materialize(tree, workDir);
                git.add().addFilepattern(".").call();

                if (git.status().call().isClean()) {
                    ObjectId head = git.getRepository().resolve(Constants.HEAD);
                    log.info("Repository {} already matches the rendered tree, nothing to push", repository.getName());
                    return PublishResultDto.builder()
                            .repositoryName(repository.getName())
                            .branch(branch)
                            .commitSha(head == null ? null : head.getName())
                            .changed(false)
                            .success(true)
                            .build();
                }

                PersonIdent author = new PersonIdent(
                        properties.getGit().getAuthorName(), properties.getGit().getAuthorEmail());
                RevCommit commit = git.commit()
                        .setMessage(commitMessage)
                        .setAuthor(author)
                        .setCommitter(author)
                        .call();

                Iterable<PushResult> results = git.push()
                        .setRemote(Constants.DEFAULT_REMOTE_NAME)
                        .setRefSpecs(new RefSpec(Constants.R_HEADS + branch + ":" + Constants.R_HEADS + branch))
                        .setCredentialsProvider(credentialsProvider())
                        .setTimeout(properties.getGit().getTimeoutSeconds())
                        .call();
                verifyPushed(results);

                log.info("Pushed {} to {} ({})", commit.getName().substring(0, 7), repository.getName(), branch);
                return PublishResultDto.builder()
                        .repositoryName(repository.getName())
                        .branch(branch)
                        .commitSha(commit.getName())
                        .changed(true)
                        .success(true)
                        .build();
            }
        } catch (GitAPIException | IOException | RenderException | IllegalStateException e) {
            log.error("Failed to publish to repository {}: {}", repository.getName(), e.getMessage());
            return PublishResultDto.builder()
                    .repositoryName(repository.getName())
                    .success(false)
                    .errorMessage(e.getMessage())
                    .build();
        } finally {
            cleanupWorkDir(workDir);
        }
    }

    /**
     * Returns the branch to commit on. A freshly cloned empty repository has no branch yet, so HEAD
     * is pointed at the configured default branch.
     */
    private String checkoutBranch(Git git, String preferredBranch) throws IOException {
        if (git.getRepository().resolve(Constants.HEAD) != null) {
            String current = git.getRepository().getBranch();
            log.debug("Detected default branch: {}", current);
            return current;
        }

        String branch = preferredBranch != null ? preferredBranch : properties.getGit().getDefaultBranch();
        RefUpdate.Result result = git.getRepository().updateRef(Constants.HEAD).link(Constants.R_HEADS + branch);
        log.info("Repository is empty, starting branch {} ({})", branch, result);
        return branch;
    }

    private void verifyPushed(Iterable<PushResult> results) {
        for (PushResult result : results) {
            for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                RemoteRefUpdate.Status status = update.getStatus();
                if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                    throw new IllegalStateException("Push of " + update.getRemoteName() + " rejected: " + status
                            + (update.getMessage() != null ? " (" + update.getMessage() + ")" : ""));
                }
            }
        }
    }

    private CredentialsProvider credentialsProvider() {
        OnboardingProperties.GitHub github = properties.getGithub();
        String username = github.getOwner() != null ? github.getOwner() : "";
        String token = github.getToken() != null ? github.getToken() : "";
        return new UsernamePasswordCredentialsProvider(username, token);
    }

    private void cleanupWorkDir(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()) // Delete files before directories
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            log.warn("Failed to delete: {}", path);
                        }
                    });
            log.debug("Cleaned up working copy: {}", directory);
        } catch (IOException e) {
            log.warn("Failed to cleanup working copy {}: {}", directory, e.getMessage());
        }
    }
}
