package sbhackathon.koala.goldenPath.provision;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class RepositoryPair {
    private final RepositoryRef source;
    private final RepositoryRef config;
}
