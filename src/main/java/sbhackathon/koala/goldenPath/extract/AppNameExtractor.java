package sbhackathon.koala.goldenPath.extract;

/**
 * Turns a free-text deployment request into an application identifier.
 *
 * <p>Implementations never throw: when nothing can be recognized they degrade to a fixed default.
 */
@FunctionalInterface
public interface AppNameExtractor {

    /**
     * @param request the developer's request, may be empty or null
     * @return the identifier to use for the whole run
     */
    AppIdentifier extract(String request);
}
