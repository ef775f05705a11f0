package sbhackathon.koala.goldenPath.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sbhackathon.koala.goldenPath.common.ErrorType;
import sbhackathon.koala.goldenPath.common.OnboardingError;
import sbhackathon.koala.goldenPath.common.StageResult;
import sbhackathon.koala.goldenPath.config.KubernetesConfig;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;
import sbhackathon.koala.goldenPath.extract.AppIdentifier;
import sbhackathon.koala.goldenPath.extract.AppNameExtractor;
import sbhackathon.koala.goldenPath.provision.RepositoryPair;
import sbhackathon.koala.goldenPath.provision.RepositoryProvisioner;
import sbhackathon.koala.goldenPath.provision.RepositoryRef;
import sbhackathon.koala.goldenPath.publish.GitService;
import sbhackathon.koala.goldenPath.publish.PublishResultDto;
import sbhackathon.koala.goldenPath.register.DeploymentDescriptor;
import sbhackathon.koala.goldenPath.register.DeploymentRegistrar;
import sbhackathon.koala.goldenPath.template.RenderException;
import sbhackathon.koala.goldenPath.template.RenderedTree;
import sbhackathon.koala.goldenPath.template.TemplateRenderer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one onboarding request through extraction, provisioning, rendering, publishing and
 * registration.
 *
 * <p>Both trees are rendered in memory before anything is pushed, so a template error never leaves a
 * commit behind. A failed run is not rolled back; its report lists what was created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OnboardingOrchestrator {

    private final PreconditionValidator preconditionValidator;
    private final AppNameExtractor appNameExtractor;
    private final RepositoryProvisioner repositoryProvisioner;
    private final TemplateRenderer templateRenderer;
    private final GitService gitService;
    private final DeploymentRegistrar deploymentRegistrar;
    private final OnboardingEventPublisher eventPublisher;
    private final OnboardingProperties properties;
    private final KubernetesConfig kubernetesConfig;

    public OnboardingReport run(String request) {
        Run run = new Run();
        try {
            return execute(run, request == null ? "" : request);
        } catch (RuntimeException e) {
            log.error("Unexpected error in stage {}", run.state, e);
            return run.fail(OnboardingError.of(errorTypeOf(run.state),
                    "Unexpected error in stage " + run.state + ": " + e.getMessage(), e));
        }
    }

    private OnboardingReport execute(Run run, String request) {
        List<String> problems = preconditionValidator.findProblems();
        if (!problems.isEmpty()) {
            return run.fail(new OnboardingError(ErrorType.PRECONDITION,
                    "Preconditions not met: " + String.join("; ", problems), null, List.of()));
        }

        run.enter(OnboardingState.EXTRACTING);
        run.appIdentifier = appNameExtractor.extract(request);
        run.succeeded("Application name: " + run.appIdentifier);

        run.enter(OnboardingState.PROVISIONING);
        StageResult<RepositoryPair> provisioned = repositoryProvisioner.provision(run.appIdentifier);
        if (provisioned instanceof StageResult.Failure<RepositoryPair> failure) {
            return run.fail(failure.error());
        }
        RepositoryPair repositories = ((StageResult.Success<RepositoryPair>) provisioned).value();
        run.repositories = repositories;
        run.artifacts.add("repository:" + repositories.getSource().getName());
        run.artifacts.add("repository:" + repositories.getConfig().getName());
        run.succeeded("Repositories: " + repositories.getSource().getCloneUrl()
                + ", " + repositories.getConfig().getCloneUrl());

        run.enter(OnboardingState.RENDERING_SOURCE);
        StageResult<RenderedTree> source = render(properties.getTemplates().getSourcePath(),
                bindings(run.appIdentifier, repositories, "NodeJS application for " + run.appIdentifier));
        if (source instanceof StageResult.Failure<RenderedTree> failure) {
            return run.fail(failure.error());
        }
        RenderedTree sourceTree = ((StageResult.Success<RenderedTree>) source).value();
        run.succeeded(sourceTree.size() + " source file(s) rendered");

        run.enter(OnboardingState.RENDERING_CONFIG);
        StageResult<RenderedTree> config = render(properties.getTemplates().getConfigPath(),
                bindings(run.appIdentifier, repositories, "GitOps configuration for " + run.appIdentifier));
        if (config instanceof StageResult.Failure<RenderedTree> failure) {
            return run.fail(failure.error());
        }
        RenderedTree configTree = ((StageResult.Success<RenderedTree>) config).value();
        run.succeeded(configTree.size() + " config file(s) rendered");

        run.enter(OnboardingState.PUBLISHING);
        StageResult<PublishResultDto> publishedSource = publish(run, repositories.getSource(), sourceTree,
                "NodeJS application for " + run.appIdentifier);
        if (publishedSource instanceof StageResult.Failure<PublishResultDto> failure) {
            return run.fail(failure.error());
        }
        StageResult<PublishResultDto> publishedConfig = publish(run, repositories.getConfig(), configTree,
                "GitOps configuration for " + run.appIdentifier);
        if (publishedConfig instanceof StageResult.Failure<PublishResultDto> failure) {
            return run.fail(failure.error());
        }
        run.succeeded("Both repositories published");

        run.enter(OnboardingState.REGISTERING);
        StageResult<DeploymentDescriptor> registered =
                deploymentRegistrar.register(run.appIdentifier, repositories.getConfig());
        if (registered instanceof StageResult.Failure<DeploymentDescriptor> failure) {
            return run.fail(failure.error());
        }
        DeploymentDescriptor descriptor = ((StageResult.Success<DeploymentDescriptor>) registered).value();
        run.artifacts.add("application:" + descriptor.getControllerNamespace() + "/" + descriptor.getName());
        run.succeeded("Application " + descriptor.getName() + " registered");

        return run.done(descriptor.getName());
    }

    private StageResult<RenderedTree> render(String templatePath, Map<String, String> bindings) {
        try {
            Path root = templatePath == null ? null : Path.of(templatePath);
            return StageResult.success(templateRenderer.render(root, bindings));
        } catch (RenderException e) {
            return StageResult.failure(OnboardingError.of(ErrorType.RENDER, e.getMessage(), e));
        }
    }

    private StageResult<PublishResultDto> publish(Run run, RepositoryRef repository, RenderedTree tree,
                                                  String description) {
        String message = "Initial commit for " + run.appIdentifier + "\n\n" + description;
        PublishResultDto result = gitService.publish(repository, tree, message);
        if (!result.isSuccess()) {
            return StageResult.failure(new OnboardingError(ErrorType.PUBLISH,
                    String.format("Repository '%s' could not be published", repository.getName()),
                    result.getErrorMessage(), List.of()));
        }
        if (result.isChanged()) {
            run.artifacts.add("commit:" + repository.getName() + "@" + result.getCommitSha());
        }
        return StageResult.success(result);
    }

    Map<String, String> bindings(AppIdentifier appIdentifier, RepositoryPair repositories, String description) {
        OnboardingProperties.App app = properties.getApp();
        String owner = properties.getGithub().getOwner();

        Map<String, String> bindings = new LinkedHashMap<>();
        bindings.put("appName", appIdentifier.value());
        bindings.put("description", description);
        bindings.put("language", app.getLanguage());
        bindings.put("author", app.getAuthor());
        bindings.put("repositoryUrl", repositories.getSource().getCloneUrl());
        bindings.put("sourceRepositoryUrl", repositories.getSource().getCloneUrl());
        bindings.put("configRepositoryUrl", repositories.getConfig().getCloneUrl());
        bindings.put("imageName", owner.toLowerCase(Locale.ROOT) + "/" + appIdentifier.value());
        bindings.put("imageTag", app.getImageTag());
        bindings.put("ingressHost", appIdentifier.ingressHost(app.getIngressDomain()));
        bindings.put("namespace", kubernetesConfig.getNamespace());
        return bindings;
    }

    private static ErrorType errorTypeOf(OnboardingState state) {
        return switch (state) {
            case PROVISIONING -> ErrorType.PROVISION;
            case RENDERING_SOURCE, RENDERING_CONFIG -> ErrorType.RENDER;
            case PUBLISHING -> ErrorType.PUBLISH;
            case REGISTERING, DONE -> ErrorType.REGISTRATION;
            case START, EXTRACTING, FAILED -> ErrorType.PRECONDITION;
        };
    }

    /**
     * Mutable progress of a single run.
     */
    private final class Run {
        private OnboardingState state = OnboardingState.START;
        private AppIdentifier appIdentifier;
        private RepositoryPair repositories;
        private final List<String> artifacts = new ArrayList<>();

        void enter(OnboardingState next) {
            state = StateTransition.transition(state, next);
            eventPublisher.publish(state, OnboardingEvent.Outcome.STARTED, appName(), "Stage started");
        }

        void succeeded(String message) {
            eventPublisher.publish(state, OnboardingEvent.Outcome.SUCCEEDED, appName(), message);
        }

        OnboardingReport fail(OnboardingError error) {
            OnboardingState failedStage = state;
            eventPublisher.publish(failedStage, OnboardingEvent.Outcome.FAILED, appName(), error.message());
            state = StateTransition.transition(state, OnboardingState.FAILED);

            List<String> known = new ArrayList<>(artifacts);
            error.artifacts().stream().filter(a -> !known.contains(a)).forEach(known::add);
            log.error("Onboarding failed in stage {} for {}: {} (artifacts: {})",
                    failedStage, appName(), error.message(), known);

            return report().failedStage(failedStage).error(error).artifacts(known).build();
        }

        OnboardingReport done(String descriptorName) {
            state = StateTransition.transition(state, OnboardingState.DONE);
            eventPublisher.publish(state, OnboardingEvent.Outcome.SUCCEEDED, appName(), "Onboarding complete");
            return report().descriptorName(descriptorName).artifacts(artifacts).build();
        }

        private OnboardingReport.OnboardingReportBuilder report() {
            return OnboardingReport.builder()
                    .appName(appName())
                    .state(state)
                    .sourceRepository(repositories != null ? repositories.getSource() : null)
                    .configRepository(repositories != null ? repositories.getConfig() : null)
                    .descriptorName(null);
        }

        private String appName() {
            return appIdentifier != null ? appIdentifier.value() : null;
        }
    }
}
