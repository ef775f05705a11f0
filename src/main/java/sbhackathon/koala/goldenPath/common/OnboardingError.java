package sbhackathon.koala.goldenPath.common;

import java.util.List;

/**
 * Typed failure of one pipeline stage.
 *
 * @param type      failure category
 * @param message   human readable description, names the resources involved
 * @param cause     message of the underlying exception, may be null
 * @param artifacts resources the failing stage did manage to create before failing
 */
public record OnboardingError(
        ErrorType type,
        String message,
        String cause,
        List<String> artifacts
) {

    public OnboardingError {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static OnboardingError of(ErrorType type, String message) {
        return new OnboardingError(type, message, null, List.of());
    }

    public static OnboardingError of(ErrorType type, String message, Throwable cause) {
        return new OnboardingError(type, message, cause == null ? null : cause.getMessage(), List.of());
    }
}
