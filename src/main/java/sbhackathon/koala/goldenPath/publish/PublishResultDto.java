package sbhackathon.koala.goldenPath.publish;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PublishResultDto {
    private final String repositoryName;
    private final String branch;
    private final String commitSha;
    /**
     * False when the rendered tree matched the repository content and nothing was pushed.
     */
    private final boolean changed;
    private final boolean success;
    private final String errorMessage;
}
