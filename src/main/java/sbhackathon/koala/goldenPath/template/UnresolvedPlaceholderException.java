package sbhackathon.koala.goldenPath.template;

import java.util.Set;

/**
 * A recognized placeholder had no binding, or survived substitution.
 */
public class UnresolvedPlaceholderException extends RenderException {

    private final String relativePath;
    private final Set<String> placeholders;

    public UnresolvedPlaceholderException(String relativePath, Set<String> placeholders) {
        super("Unresolved placeholder(s) " + placeholders + " in template file: " + relativePath);
        this.relativePath = relativePath;
        this.placeholders = Set.copyOf(placeholders);
    }

    public String getRelativePath() {
        return relativePath;
    }

    public Set<String> getPlaceholders() {
        return placeholders;
    }
}
