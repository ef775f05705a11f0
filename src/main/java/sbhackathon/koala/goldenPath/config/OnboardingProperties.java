package sbhackathon.koala.goldenPath.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for one onboarding run, bound from the {@code onboarding.*} properties.
 *
 * <p>Credentials arrive here from the environment through {@code application.yml}; the pipeline
 * stages receive this object at construction time and never read the environment themselves.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "onboarding")
public class OnboardingProperties {

    /**
     * Identifier used when neither the model nor the fallback patterns produce one.
     */
    private String defaultAppName = "my-app";

    /**
     * Parent directory of the per-run Git working copies.
     */
    private String workspacePath = System.getProperty("java.io.tmpdir") + "/golden-path";

    private GitHub github = new GitHub();
    private Templates templates = new Templates();
    private Model model = new Model();
    private Git git = new Git();
    private App app = new App();

    @Getter
    @Setter
    public static class GitHub {
        private String apiUrl = "https://api.github.com";
        private String webUrl = "https://github.com";
        private String token;
        private String owner;
        /**
         * Create repositories under the {@link #owner} organization instead of the token's user.
         */
        private boolean organization = false;
        private boolean privateRepositories = false;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Templates {
        private String sourcePath;
        private String configPath;
    }

    @Getter
    @Setter
    public static class Model {
        private boolean enabled = true;
        private String apiKey;
        private String name = "openai/gpt-3.5-turbo";
        private int maxTokens = 50;
        private double temperature = 0.1;
    }

    @Getter
    @Setter
    public static class Git {
        private String authorName = "AI Onboarding Agent";
        private String authorEmail = "agent@example.com";
        private String defaultBranch = "main";
        private int timeoutSeconds = 60;
    }

    @Getter
    @Setter
    public static class App {
        private String language = "NodeJS";
        private String author = "AI Onboarding Agent";
        private String imageTag = "latest";
        private String ingressDomain = "cnoe.localtest.me";
    }
}
