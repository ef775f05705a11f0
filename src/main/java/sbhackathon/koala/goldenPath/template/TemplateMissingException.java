package sbhackathon.koala.goldenPath.template;

import java.nio.file.Path;

public class TemplateMissingException extends RenderException {

    private final Path templateRoot;

    public TemplateMissingException(Path templateRoot) {
        super("Template path does not exist or is not a directory: " + templateRoot);
        this.templateRoot = templateRoot;
    }

    public Path getTemplateRoot() {
        return templateRoot;
    }
}
