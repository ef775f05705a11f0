package sbhackathon.koala.goldenPath.extract;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalized application name shared by every artifact of one onboarding run.
 *
 * <p>Always matches {@code [a-z0-9-]+}, is 1 to 63 characters long and has no leading, trailing or
 * repeated hyphen, so it is usable as a repository name, a Kubernetes resource name and a DNS label.
 *
 * @param value the identifier text
 */
public record AppIdentifier(String value) {

    public static final int MAX_LENGTH = 63;

    private static final Pattern CANONICAL = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    public AppIdentifier {
        if (value == null || value.isEmpty() || value.length() > MAX_LENGTH
                || !CANONICAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a valid application identifier: '" + value + "'");
        }
    }

    /**
     * Lowercases, strips everything outside {@code [a-z0-9-]}, collapses hyphens, trims hyphens at
     * both ends and truncates to {@link #MAX_LENGTH}.
     *
     * @param raw free text, may be null
     * @return the identifier, or empty when nothing usable is left
     */
    public static Optional<AppIdentifier> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
        if (normalized.length() > MAX_LENGTH) {
            normalized = normalized.substring(0, MAX_LENGTH).replaceAll("-$", "");
        }
        return normalized.isEmpty() ? Optional.empty() : Optional.of(new AppIdentifier(normalized));
    }

    public String sourceRepositoryName() {
        return value + "-source";
    }

    public String configRepositoryName() {
        return value + "-config";
    }

    public String ingressHost(String domain) {
        return domain == null || domain.isBlank() ? value : value + "." + domain;
    }

    @Override
    public String toString() {
        return value;
    }
}
