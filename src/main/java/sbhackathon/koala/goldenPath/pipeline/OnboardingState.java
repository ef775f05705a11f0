package sbhackathon.koala.goldenPath.pipeline;

/**
 * Stages of one onboarding run.
 *
 * <pre>
 * START → EXTRACTING → PROVISIONING → RENDERING_SOURCE → RENDERING_CONFIG
 *       → PUBLISHING → REGISTERING → DONE
 *
 * every non-terminal state → FAILED
 * </pre>
 */
public enum OnboardingState {
    START,
    EXTRACTING,
    PROVISIONING,
    RENDERING_SOURCE,
    RENDERING_CONFIG,
    PUBLISHING,
    REGISTERING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
