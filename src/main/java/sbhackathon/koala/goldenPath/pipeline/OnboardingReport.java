package sbhackathon.koala.goldenPath.pipeline;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import sbhackathon.koala.goldenPath.common.ErrorType;
import sbhackathon.koala.goldenPath.common.OnboardingError;
import sbhackathon.koala.goldenPath.provision.RepositoryRef;

import java.util.List;

/**
 * Final outcome of an onboarding run. On failure it names the failing stage and every artifact known
 * to exist, so they can be inspected or cleaned up by hand.
 */
@Getter
@Builder
public class OnboardingReport {
    private final String appName;
    private final OnboardingState state;
    private final OnboardingState failedStage;
    private final OnboardingError error;
    private final RepositoryRef sourceRepository;
    private final RepositoryRef configRepository;
    private final String descriptorName;
    @Singular
    private final List<String> artifacts;

    public boolean isSuccess() {
        return state == OnboardingState.DONE;
    }

    public boolean isPreconditionFailure() {
        return error != null && error.type() == ErrorType.PRECONDITION;
    }
}
