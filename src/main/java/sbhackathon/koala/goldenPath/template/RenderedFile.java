package sbhackathon.koala.goldenPath.template;

import lombok.Builder;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

@Getter
@Builder
public class RenderedFile {
    /**
     * Path relative to the tree root, always with '/' separators.
     */
    private final String relativePath;
    private final byte[] content;
    /**
     * Empty when the template's file system has no POSIX permissions.
     */
    private final Set<PosixFilePermission> permissions;

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
