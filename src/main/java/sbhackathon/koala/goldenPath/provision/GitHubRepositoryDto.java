package sbhackathon.koala.goldenPath.provision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The part of GitHub's repository resource the provisioner needs.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitHubRepositoryDto {

    private long id;

    private String name;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("clone_url")
    private String cloneUrl;

    @JsonProperty("html_url")
    private String htmlUrl;

    @JsonProperty("default_branch")
    private String defaultBranch;
}
