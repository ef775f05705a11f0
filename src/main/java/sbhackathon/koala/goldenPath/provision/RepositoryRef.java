package sbhackathon.koala.goldenPath.provision;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class RepositoryRef {
    private final String name;
    private final String cloneUrl;
    private final String webUrl;
    private final String defaultBranch;
    /**
     * The repository was there before this run.
     */
    private final boolean existedBefore;
    /**
     * Existence was assumed from an "already exists" answer, the repository was never read.
     */
    private final boolean inferred;
}
