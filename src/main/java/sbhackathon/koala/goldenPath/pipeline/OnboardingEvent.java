package sbhackathon.koala.goldenPath.pipeline;

import java.time.Instant;

/**
 * @param appName null until the name has been extracted
 */
public record OnboardingEvent(
        OnboardingState stage,
        Outcome outcome,
        String appName,
        Instant timestamp,
        String message
) {

    public enum Outcome {
        STARTED,
        SUCCEEDED,
        FAILED
    }
}
