package sbhackathon.koala.goldenPath.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ApplicationStatusResponse {
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String UNKNOWN = "Unknown";

    private final String appName;
    private final boolean registered;
    private final String syncStatus;
    private final String healthStatus;
    private final String revision;
    private final String repositoryUrl;
    private final String message;
}
