package sbhackathon.koala.goldenPath.pipeline;

/**
 * Validates onboarding state transitions.
 *
 * <p>Stages only move forward one step at a time. Any non-terminal state may move to
 * {@link OnboardingState#FAILED}; nothing leaves {@code DONE} or {@code FAILED}.
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException if either state is null
     * @throws IllegalStateException    if the transition is not allowed
     */
    public static void validate(OnboardingState from, OnboardingState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                    String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        // any running stage may fail
        if (to == OnboardingState.FAILED) {
            return;
        }

        boolean valid = switch (from) {
            case START -> to == OnboardingState.EXTRACTING;
            case EXTRACTING -> to == OnboardingState.PROVISIONING;
            case PROVISIONING -> to == OnboardingState.RENDERING_SOURCE;
            case RENDERING_SOURCE -> to == OnboardingState.RENDERING_CONFIG;
            case RENDERING_CONFIG -> to == OnboardingState.PUBLISHING;
            case PUBLISHING -> to == OnboardingState.REGISTERING;
            case REGISTERING -> to == OnboardingState.DONE;
            case DONE, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                    String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    public static OnboardingState transition(OnboardingState current, OnboardingState next) {
        validate(current, next);
        return next;
    }
}
