package org.carball.advisor.analyzer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Finds the source files under a root directory, skipping VCS metadata,
 * build output and any caller-supplied path fragments.
 */
@Slf4j
public class SourceFileScanner {

    public static final List<String> DEFAULT_EXCLUDES = List.of(
            "/.git/", "/.svn/", "/.hg/", "/.idea/", "/.gradle/", "/.mvn/",
            "/target/", "/build/", "/out/", "/node_modules/",
            "/.venv/", "/venv/", "/__pycache__/");

    private final List<String> fileExtensions;
    private final List<String> excludePatterns;

    public SourceFileScanner(Collection<String> fileExtensions, Collection<String> excludePatterns) {
        this.fileExtensions = List.copyOf(fileExtensions);
        List<String> excludes = new ArrayList<>(DEFAULT_EXCLUDES);
        excludes.addAll(excludePatterns);
        this.excludePatterns = List.copyOf(excludes);
    }

    /**
     * Eligible files, sorted by their root-relative path. Entries below the
     * root that cannot be read are logged and skipped; only a root that
     * cannot be walked at all fails the scan.
     */
    public List<Path> scan(Path root) {
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasSourceExtension(file)
                            && !isExcluded(relativePath(root, file))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                    if (file.equals(root)) {
                        throw e;
                    }
                    log.warn("Error reading file: {} - {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk directory: " + root, e);
        }

        files.sort(Comparator.comparing((Path path) -> relativePath(root, path)));
        log.debug("Found {} source files under {}", files.size(), root);
        return files;
    }

    /**
     * Root-relative path with {@code /} separators, used both for exclusion
     * matching and as the report key.
     */
    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    boolean isExcluded(String relativePath) {
        String candidate = "/" + relativePath;
        return excludePatterns.stream().anyMatch(candidate::contains);
    }

    private boolean hasSourceExtension(Path path) {
        String fileName = path.getFileName().toString();
        return fileExtensions.stream().anyMatch(fileName::endsWith);
    }
}
