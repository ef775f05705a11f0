package sbhackathon.koala.goldenPath.publish;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.provision.RepositoryRef;
import sbhackathon.koala.goldenPath.template.RenderedTree;
import sbhackathon.koala.goldenPath.template.TemplateRenderer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GitServiceTest {

    @TempDir
    Path tempDir;

    private Path workspace;
    private Path remote;
    private TemplateRenderer renderer;
    private GitService gitService;

    @BeforeEach
    void setUp() throws Exception {
        workspace = tempDir.resolve("workspace");
        remote = tempDir.resolve("remote.git");
        Git.init().setBare(true).setInitialBranch("main").setDirectory(remote.toFile()).call().close();

        OnboardingProperties properties = new OnboardingProperties();
        properties.setWorkspacePath(workspace.toString());
        properties.getGithub().setOwner("octo");
        properties.getGithub().setToken("test-token");

        renderer = new TemplateRenderer();
        gitService = new GitService(renderer, properties);
    }

    @Test
    void publish_pushesRenderedTreeToEmptyRepository() throws Exception {
        PublishResultDto result = gitService.publish(repository(), tree("inventory-api"), "Initial commit for inventory-api");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isChanged()).isTrue();
        assertThat(result.getBranch()).isEqualTo("main");

        Path checkout = tempDir.resolve("verify");
        try (Git git = Git.cloneRepository().setURI(remote.toUri().toString()).setDirectory(checkout.toFile()).call()) {
            RevCommit head = git.log().call().iterator().next();
            assertThat(head.getName()).isEqualTo(result.getCommitSha());
            assertThat(head.getFullMessage()).isEqualTo("Initial commit for inventory-api");
            assertThat(head.getAuthorIdent().getName()).isEqualTo("AI Onboarding Agent");
        }
        assertThat(checkout.resolve("package.json")).hasContent("{\"name\": \"inventory-api\"}");
        assertThat(checkout.resolve("k8s/service.yaml")).hasContent("name: inventory-api");
    }

    @Test
    void publish_sameTreeTwiceCreatesNoSecondCommit() {
        PublishResultDto first = gitService.publish(repository(), tree("inventory-api"), "Initial commit for inventory-api");
        PublishResultDto second = gitService.publish(repository(), tree("inventory-api"), "Initial commit for inventory-api");

        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isChanged()).isFalse();
        assertThat(second.getCommitSha()).isEqualTo(first.getCommitSha());
    }

    @Test
    void publish_changedTreeAddsCommitOnExistingBranch() {
        PublishResultDto first = gitService.publish(repository(), tree("inventory-api"), "first");
        PublishResultDto second = gitService.publish(repository(), tree("inventory-service"), "second");

        assertThat(second.isChanged()).isTrue();
        assertThat(second.getCommitSha()).isNotEqualTo(first.getCommitSha());
        assertThat(second.getBranch()).isEqualTo("main");
    }

    @Test
    void publish_removesWorkingCopy() throws Exception {
        gitService.publish(repository(), tree("inventory-api"), "Initial commit for inventory-api");

        try (var entries = Files.list(workspace)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void publish_unreachableRepositoryIsReportedNotThrown() throws Exception {
        RepositoryRef missing = RepositoryRef.builder()
                .name("missing-config")
                .cloneUrl(tempDir.resolve("missing.git").toUri().toString())
                .defaultBranch("main")
                .build();

        PublishResultDto result = gitService.publish(missing, tree("inventory-api"), "Initial commit");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isNotBlank();
        try (var entries = Files.list(workspace)) {
            assertThat(entries).isEmpty();
        }
    }

    private RepositoryRef repository() {
        return RepositoryRef.builder()
                .name("inventory-api-source")
                .cloneUrl(remote.toUri().toString())
                .webUrl(remote.toUri().toString())
                .defaultBranch("main")
                .build();
    }

    private RenderedTree tree(String appName) {
        try {
            Path template = Files.createDirectories(tempDir.resolve("template"));
            Files.writeString(template.resolve("package.json"), "{\"name\": \"{{appName}}\"}");
            Files.createDirectories(template.resolve("k8s"));
            Files.writeString(template.resolve("k8s/service.yaml"), "name: {{ appName }}");
            return renderer.render(template, Map.of("appName", appName));
        } catch (java.io.IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
