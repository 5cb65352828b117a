package org.carball.advisor.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class SourceFileScannerTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldExcludeDefaultDirectories() {
        SourceFileScanner scanner = new SourceFileScanner(List.of(".java"), List.of());

        assertThat(scanner.isExcluded("target/classes/App.java")).isTrue();
        assertThat(scanner.isExcluded("web/node_modules/lib/App.java")).isTrue();
        assertThat(scanner.isExcluded(".git/hooks/App.java")).isTrue();
        assertThat(scanner.isExcluded("src/main/java/App.java")).isFalse();
        assertThat(scanner.isExcluded("src/targeting/App.java")).isFalse();
    }

    @Test
    public void shouldApplyCallerExcludes() {
        SourceFileScanner scanner = new SourceFileScanner(List.of(".java"), List.of("generated"));

        assertThat(scanner.isExcluded("src/generated/Model.java")).isTrue();
        assertThat(scanner.isExcluded("src/main/Model.java")).isFalse();
    }

    @Test
    public void shouldScanSortedByRelativePath() throws IOException {
        // Given
        Files.createDirectories(tempDir.resolve("b"));
        Files.createDirectories(tempDir.resolve("a/target"));
        Files.writeString(tempDir.resolve("b/Second.java"), "class Second {}");
        Files.writeString(tempDir.resolve("a/First.java"), "class First {}");
        Files.writeString(tempDir.resolve("a/target/Built.java"), "class Built {}");
        Files.writeString(tempDir.resolve("a/notes.md"), "# notes");

        SourceFileScanner scanner = new SourceFileScanner(List.of(".java"), List.of());

        // When
        List<Path> files = scanner.scan(tempDir);

        // Then
        assertThat(files).extracting(file -> SourceFileScanner.relativePath(tempDir, file))
                .containsExactly("a/First.java", "b/Second.java");
    }

    @Test
    public void shouldFailWhenRootCannotBeWalked() {
        SourceFileScanner scanner = new SourceFileScanner(List.of(".java"), List.of());

        assertThatThrownBy(() -> scanner.scan(tempDir.resolve("absent")))
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    public void shouldSkipUnreadableDirectoryAndKeepScanning() throws IOException {
        // Given
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Files.createDirectories(tempDir.resolve("ok"));
        Files.writeString(tempDir.resolve("ok/Readable.java"), "class Readable {}");
        Path locked = Files.createDirectories(tempDir.resolve("locked"));
        Files.writeString(locked.resolve("Hidden.java"), "class Hidden {}");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));

        Logger logger = (Logger) LoggerFactory.getLogger(SourceFileScanner.class);
        ListAppender<ILoggingEvent> logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);

        try {
            // privileged users can still read the directory
            assumeFalse(Files.isReadable(locked));
            SourceFileScanner scanner = new SourceFileScanner(List.of(".java"), List.of());

            // When
            List<Path> files = scanner.scan(tempDir);

            // Then
            assertThat(files).extracting(file -> SourceFileScanner.relativePath(tempDir, file))
                    .containsExactly("ok/Readable.java");
            assertThat(logAppender.list)
                    .anyMatch(event -> event.getLevel() == Level.WARN
                            && event.getFormattedMessage().startsWith("Error reading file: ")
                            && event.getFormattedMessage().contains("locked"));
        } finally {
            logger.detachAppender(logAppender);
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }
}
