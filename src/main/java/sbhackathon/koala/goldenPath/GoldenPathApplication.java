package sbhackathon.koala.goldenPath;

import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Golden path onboarding service.
 *
 * <p>With a request on the command line ({@code java -jar golden-path.jar "I need a new NodeJS
 * service called inventory-api"}) it runs one onboarding and exits with the run's exit code.
 * Without one it starts the REST API.
 */
@SpringBootApplication
public class GoldenPathApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(GoldenPathApplication.class);

        if (!new DefaultApplicationArguments(args).getNonOptionArgs().isEmpty()) {
            application.setWebApplicationType(WebApplicationType.NONE);
            ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        }

        application.run(args);
    }
}
