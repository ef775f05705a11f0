package sbhackathon.koala.goldenPath.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.goldenPath.config.OnboardingProperties;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic extraction: an ordered list of phrase patterns, first match wins, then a fixed
 * default. The order is part of the observable behavior for ambiguous requests.
 */
@Slf4j
@Component
public class PatternAppNameExtractor implements AppNameExtractor {

    private static final String NAME = "([a-z0-9][a-z0-9_-]*)";
    private static final String FILLER = "(?:(?:a|an|the|my|our|new)\\s+)*";

    private static final List<Pattern> NAME_PATTERNS = List.of(
            Pattern.compile("\\bcalled\\s+[\"']?" + NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bnamed\\s+[\"']?" + NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b" + NAME + "\\s+service\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b" + NAME + "\\s+app\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdeploy\\s+" + FILLER + NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcreate\\s+" + FILLER + NAME, Pattern.CASE_INSENSITIVE)
    );

    // a capture made only of one of these is not a name ("deploy a service")
    private static final Set<String> STOP_WORDS = Set.of("a", "an", "the", "my", "our", "new");

    private final AppIdentifier defaultIdentifier;

    /**
     * @throws IllegalStateException if {@code onboarding.default-app-name} does not normalize to an
     *                               identifier
     */
    public PatternAppNameExtractor(OnboardingProperties properties) {
        this.defaultIdentifier = AppIdentifier.normalize(properties.getDefaultAppName())
                .orElseThrow(() -> new IllegalStateException(
                        "onboarding.default-app-name is not a usable identifier: " + properties.getDefaultAppName()));
    }

    @Override
    public AppIdentifier extract(String request) {
        String text = request == null ? "" : request;
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group(1);
                if (STOP_WORDS.contains(candidate.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                Optional<AppIdentifier> identifier = AppIdentifier.normalize(candidate);
                if (identifier.isPresent()) {
                    log.debug("Pattern '{}' matched '{}'", pattern.pattern(), identifier.get());
                    return identifier.get();
                }
            }
        }
        log.info("No name pattern matched, using default identifier '{}'", defaultIdentifier);
        return defaultIdentifier;
    }
}
