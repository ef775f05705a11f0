package sbhackathon.koala.goldenPath.common;

/**
 * Outcome of one pipeline stage: either the stage's value or a typed error.
 *
 * <pre>
 * if (result instanceof StageResult.Failure&lt;RepositoryPair&gt; failure) {
 *     return fail(failure.error());
 * }
 * RepositoryPair pair = ((StageResult.Success&lt;RepositoryPair&gt;) result).value();
 * </pre>
 *
 * @param <T> value produced on success
 */
public sealed interface StageResult<T> permits StageResult.Success, StageResult.Failure {

    static <T> StageResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StageResult<T> failure(OnboardingError error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success<T>(T value) implements StageResult<T> {
        public Success {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }
    }

    record Failure<T>(OnboardingError error) implements StageResult<T> {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
        }
    }
}
