package sbhackathon.koala.goldenPath.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class CleanupResponse {
    private final String appName;
    /**
     * One line per resource, e.g. {@code "repository inventory-api-source: deleted"}.
     */
    @Singular
    private final List<String> results;
    private final boolean success;
}
