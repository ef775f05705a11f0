package sbhackathon.koala.goldenPath.template;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TemplateRendererTest {

    private static final Map<String, String> BINDINGS = Map.of(
            "appName", "inventory-api",
            "description", "NodeJS application for inventory-api");

    @TempDir
    Path tempDir;

    private Path templateRoot;
    private TemplateRenderer renderer;

    @BeforeEach
    void setUp() throws IOException {
        renderer = new TemplateRenderer();
        templateRoot = Files.createDirectories(tempDir.resolve("template"));
        write("package.json", "{ \"name\": \"{{appName}}\", \"description\": \"{{ description }}\" }");
        write("k8s/service.yaml", "metadata:\n  name: {{ appName }}\n");
        write(".github/workflows/build.yml", "run: docker build -t x:${{ github.sha }} .");
    }

    @Test
    void render_substitutesEveryPlaceholder() {
        RenderedTree tree = renderer.render(templateRoot, BINDINGS);

        assertThat(tree.size()).isEqualTo(3);
        assertThat(tree.find("package.json").orElseThrow().contentAsString())
                .isEqualTo("{ \"name\": \"inventory-api\", \"description\": \"NodeJS application for inventory-api\" }");
        assertThat(tree.find("k8s/service.yaml").orElseThrow().contentAsString())
                .isEqualTo("metadata:\n  name: inventory-api\n");
    }

    @Test
    void render_leavesWorkflowExpressionsAlone() {
        RenderedTree tree = renderer.render(templateRoot, BINDINGS);

        assertThat(tree.find(".github/workflows/build.yml").orElseThrow().contentAsString())
                .isEqualTo("run: docker build -t x:${{ github.sha }} .");
    }

    @Test
    void render_isDeterministic() {
        RenderedTree first = renderer.render(templateRoot, BINDINGS);
        RenderedTree second = renderer.render(templateRoot, BINDINGS);

        assertThat(second.getFiles()).extracting(RenderedFile::getRelativePath)
                .containsExactlyElementsOf(first.getFiles().stream().map(RenderedFile::getRelativePath).toList());
        for (RenderedFile file : first.getFiles()) {
            assertThat(second.find(file.getRelativePath()).orElseThrow().getContent()).isEqualTo(file.getContent());
        }
    }

    @Test
    void render_failsOnMissingBinding() throws IOException {
        write("README.md", "# {{appName}} by {{ author }}");

        assertThatThrownBy(() -> renderer.render(templateRoot, BINDINGS))
                .isInstanceOfSatisfying(UnresolvedPlaceholderException.class, e -> {
                    assertThat(e.getRelativePath()).isEqualTo("README.md");
                    assertThat(e.getPlaceholders()).containsExactly("author");
                });
    }

    @Test
    void render_failsWhenBoundValueIsItselfAPlaceholder() {
        Map<String, String> bindings = Map.of("appName", "{{ description }}", "description", "x");

        assertThatThrownBy(() -> renderer.render(templateRoot, bindings))
                .isInstanceOf(UnresolvedPlaceholderException.class);
    }

    @Test
    void render_failsOnMissingRoot() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThatThrownBy(() -> renderer.render(missing, BINDINGS))
                .isInstanceOfSatisfying(TemplateMissingException.class,
                        e -> assertThat(e.getTemplateRoot()).isEqualTo(missing));
    }

    @Test
    void render_skipsGitDirectory() throws IOException {
        write(".git/config", "[core] {{ notBound }}");

        RenderedTree tree = renderer.render(templateRoot, BINDINGS);

        assertThat(tree.find(".git/config")).isEmpty();
    }

    @Test
    void render_copiesBinaryFilesVerbatim() throws IOException {
        byte[] binary = {(byte) 0x89, 'P', 'N', 'G', (byte) 0xFF, (byte) 0xFE, '{', '{'};
        Files.write(templateRoot.resolve("logo.png"), binary);

        RenderedTree tree = renderer.render(templateRoot, BINDINGS);

        assertThat(tree.find("logo.png").orElseThrow().getContent()).isEqualTo(binary);
    }

    @Test
    void materialize_writesAndOverwritesFiles() throws IOException {
        Path destination = tempDir.resolve("checkout");
        Files.createDirectories(destination.resolve("k8s"));
        Files.writeString(destination.resolve("k8s/service.yaml"), "stale");
        Files.writeString(destination.resolve("LICENSE"), "kept");

        renderer.materialize(renderer.render(templateRoot, BINDINGS), destination);

        assertThat(destination.resolve("k8s/service.yaml")).hasContent("metadata:\n  name: inventory-api\n");
        assertThat(destination.resolve("package.json")).exists();
        assertThat(destination.resolve("LICENSE")).hasContent("kept");
    }

    @Test
    void materialize_readOnlyTemplateCanBeWrittenAgain() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Files.setPosixFilePermissions(templateRoot.resolve("package.json"), PosixFilePermissions.fromString("r--r--r--"));
        Path destination = tempDir.resolve("checkout");

        renderer.materialize(renderer.render(templateRoot, BINDINGS), destination);
        renderer.materialize(renderer.render(templateRoot, Map.of(
                "appName", "billing-api",
                "description", "NodeJS application for billing-api")), destination);

        assertThat(destination.resolve("package.json")).content().contains("billing-api");
        assertThat(Files.getPosixFilePermissions(destination.resolve("package.json")))
                .contains(PosixFilePermission.OWNER_WRITE, PosixFilePermission.GROUP_READ, PosixFilePermission.OTHERS_READ);
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = templateRoot.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
