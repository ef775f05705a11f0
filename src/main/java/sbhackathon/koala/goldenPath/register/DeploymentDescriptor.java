package sbhackathon.koala.goldenPath.register;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Desired state handed to Argo CD: which repository to watch and where to deploy it.
 */
@Getter
@Builder
@ToString
public class DeploymentDescriptor {
    private final String name;
    private final String controllerNamespace;
    private final String project;
    private final String repositoryUrl;
    private final String targetRevision;
    private final String path;
    private final String destinationServer;
    private final String destinationNamespace;
    private final Map<String, String> labels;

    private final boolean prune;
    private final boolean selfHeal;
    private final List<String> syncOptions;
    private final int retryLimit;
    private final String backoffDuration;
    private final int backoffFactor;
    private final String backoffMaxDuration;
}
