package sbhackathon.koala.goldenPath.template;

/**
 * Base class of every failure raised while turning a template tree into a rendered tree.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
