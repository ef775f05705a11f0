package sbhackathon.koala.goldenPath.template;

import lombok.Getter;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A fully substituted copy of a template tree, ordered by relative path.
 */
@Getter
public class RenderedTree {

    private final Path templateRoot;
    private final List<RenderedFile> files;

    public RenderedTree(Path templateRoot, List<RenderedFile> files) {
        this.templateRoot = templateRoot;
        this.files = List.copyOf(files);
    }

    public Optional<RenderedFile> find(String relativePath) {
        return files.stream()
                .filter(file -> file.getRelativePath().equals(relativePath))
                .findFirst();
    }

    public int size() {
        return files.size();
    }
}
