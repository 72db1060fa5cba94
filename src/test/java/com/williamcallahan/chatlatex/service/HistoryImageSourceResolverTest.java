package com.williamcallahan.chatlatex.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.chatlatex.config.AppProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies image lookup in per-chat history folders.
 */
class HistoryImageSourceResolverTest {

    @TempDir
    Path historyRoot;

    private HistoryImageSourceResolver resolver;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getExport().setHistoryDir(historyRoot.toString());
        resolver = new HistoryImageSourceResolver(appProperties, new FileOperationsService());
    }

    @Test
    void findsImageInChatFolderByFileName() throws IOException {
        Path image = createImage(historyRoot.resolve("chat1/images/plot.png"));

        Optional<Path> resolved = resolver.resolve("some/where/plot.png", "chat1.json");

        assertEquals(Optional.of(image.toAbsolutePath()), resolved);
    }

    @Test
    void usesTempFolderWithoutChatId() throws IOException {
        Path image = createImage(historyRoot.resolve("temp/images/a.png"));

        assertEquals(Optional.of(image.toAbsolutePath()), resolver.resolve("a.png", null));
    }

    @Test
    void acceptsExistingAbsolutePath() throws IOException {
        Path image = createImage(historyRoot.resolve("elsewhere/b.png"));

        assertEquals(Optional.of(image.toAbsolutePath()), resolver.resolve(image.toAbsolutePath().toString(), "chat1"));
    }

    @Test
    void missingImagesResolveEmpty() {
        assertTrue(resolver.resolve("nope.png", "chat1").isEmpty());
        assertTrue(resolver.resolve(" ", "chat1").isEmpty());
    }

    private static Path createImage(Path path) throws IOException {
        Files.createDirectories(path.getParent());
        return Files.write(path, new byte[] {1, 2, 3});
    }
}
