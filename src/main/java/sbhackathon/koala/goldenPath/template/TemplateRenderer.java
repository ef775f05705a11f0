package sbhackathon.koala.goldenPath.template;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Substitutes {@code {{ name }}} placeholders in every file of a template directory.
 *
 * <p>An unbound placeholder is a configuration error and fails the render. {@code ${{ ... }}}
 * expressions (CI workflow syntax) are not placeholders and are copied untouched.
 */
@Slf4j
@Component
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("(?<!\\$)\\{\\{\\s*([A-Za-z_][A-Za-z0-9_.]*)\\s*}}");

    private static final boolean POSIX = FileSystems.getDefault()
            .supportedFileAttributeViews().contains("posix");

    /**
     * Renders every regular file below {@code templateRoot}, skipping {@code .git} directories.
     *
     * @throws TemplateMissingException       if the root is absent or not a directory
     * @throws UnresolvedPlaceholderException if a placeholder has no binding
     * @throws RenderException                if a template file cannot be read
     */
    public RenderedTree render(Path templateRoot, Map<String, String> bindings) {
        if (templateRoot == null || !Files.isDirectory(templateRoot)) {
            throw new TemplateMissingException(templateRoot);
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(templateRoot)) {
            sources = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> !isInsideGitDirectory(templateRoot.relativize(path)))
                    .sorted(Comparator.comparing(path -> toRelativePath(templateRoot, path)))
                    .toList();
        } catch (IOException e) {
            throw new RenderException("Failed to read template directory " + templateRoot + ": " + e.getMessage(), e);
        }

        List<RenderedFile> files = new ArrayList<>(sources.size());
        for (Path source : sources) {
            files.add(renderFile(templateRoot, source, bindings));
        }

        log.info("Rendered {} file(s) from template {}", files.size(), templateRoot);
        return new RenderedTree(templateRoot, files);
    }

    /**
     * Writes a rendered tree below {@code destination}, creating it if needed. Existing files at the
     * same relative paths are overwritten.
     */
    public void materialize(RenderedTree tree, Path destination) {
        try {
            Files.createDirectories(destination);
            Path root = destination.toAbsolutePath().normalize();
            for (RenderedFile file : tree.getFiles()) {
                Path target = root.resolve(file.getRelativePath()).normalize();
                if (!target.startsWith(root)) {
                    throw new RenderException("Rendered file escapes destination: " + file.getRelativePath());
                }
                Files.createDirectories(target.getParent());
                if (Files.isRegularFile(target) && !Files.isWritable(target)) {
                    Files.delete(target);
                }
                Files.write(target, file.getContent());
                if (POSIX && !file.getPermissions().isEmpty()) {
                    Files.setPosixFilePermissions(target, writable(file.getPermissions()));
                }
            }
            log.debug("Wrote {} rendered file(s) to {}", tree.size(), destination);
        } catch (IOException e) {
            throw new RenderException("Failed to write rendered files to " + destination + ": " + e.getMessage(), e);
        }
    }

    private RenderedFile renderFile(Path templateRoot, Path source, Map<String, String> bindings) {
        String relativePath = toRelativePath(templateRoot, source);
        try {
            byte[] raw = Files.readAllBytes(source);
            byte[] content = decodeUtf8(raw)
                    .map(text -> substitute(relativePath, text, bindings).getBytes(StandardCharsets.UTF_8))
                    .orElse(raw);

            return RenderedFile.builder()
                    .relativePath(relativePath)
                    .content(content)
                    .permissions(POSIX ? Files.getPosixFilePermissions(source) : Set.<PosixFilePermission>of())
                    .build();
        } catch (IOException e) {
            throw new RenderException("Failed to read template file " + relativePath + ": " + e.getMessage(), e);
        }
    }

    private String substitute(String relativePath, String text, Map<String, String> bindings) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder rendered = new StringBuilder();
        Set<String> missing = new TreeSet<>();

        while (matcher.find()) {
            String name = matcher.group(1);
            String value = bindings.get(name);
            if (value == null) {
                missing.add(name);
                continue;
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);

        if (!missing.isEmpty()) {
            throw new UnresolvedPlaceholderException(relativePath, missing);
        }

        // a bound value may itself look like a placeholder
        Set<String> leftover = findPlaceholders(rendered);
        if (!leftover.isEmpty()) {
            throw new UnresolvedPlaceholderException(relativePath, leftover);
        }
        return rendered.toString();
    }

    private Set<String> findPlaceholders(CharSequence text) {
        Set<String> names = new TreeSet<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private Optional<String> decodeUtf8(byte[] raw) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString());
        } catch (CharacterCodingException e) {
            // binary file, copied as-is
            return Optional.empty();
        }
    }

    // read-only templates (mounted volumes) must not produce files a later run cannot overwrite
    private static Set<PosixFilePermission> writable(Set<PosixFilePermission> permissions) {
        Set<PosixFilePermission> applied = EnumSet.copyOf(permissions);
        applied.add(PosixFilePermission.OWNER_READ);
        applied.add(PosixFilePermission.OWNER_WRITE);
        return applied;
    }

    private static boolean isInsideGitDirectory(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().equals(".git")) {
                return true;
            }
        }
        return false;
    }

    private static String toRelativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
