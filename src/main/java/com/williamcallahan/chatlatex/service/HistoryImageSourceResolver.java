package com.williamcallahan.chatlatex.service;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.service.latex.ImageSourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves image tags against the conversation history folders.
 *
 * <p>Absolute sources are used as given. Anything else is looked up by file name under
 * {@code <history-dir>/<chatId>/images/}, or {@code <history-dir>/temp/images/} when the message
 * has no chat. A source only resolves when the file exists.</p>
 */
@Component
public class HistoryImageSourceResolver implements ImageSourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(HistoryImageSourceResolver.class);
    private static final String IMAGES_DIR = "images";
    private static final String TEMP_CHAT_DIR = "temp";
    private static final String HISTORY_FILE_SUFFIX = ".json";

    private final Path historyRoot;
    private final FileOperationsService fileOperations;

    public HistoryImageSourceResolver(AppProperties appProperties, FileOperationsService fileOperations) {
        this.historyRoot = Path.of(appProperties.getExport().getHistoryDir());
        this.fileOperations = fileOperations;
    }

    @Override
    public Optional<Path> resolve(String source, String chatId) {
        if (source == null || source.isBlank()) {
            return Optional.empty();
        }
        try {
            Path sourcePath = Path.of(source.trim());
            Path candidate = sourcePath.isAbsolute() ? sourcePath : imagesDirectory(chatId).resolve(fileNameOf(sourcePath));
            if (fileOperations.fileExists(candidate)) {
                return Optional.of(candidate.toAbsolutePath());
            }
            logger.debug("Image {} not found at {}", source, candidate);
        } catch (InvalidPathException invalidPath) {
            logger.debug("Image source is not a usable path: {}", invalidPath.getMessage());
        }
        return Optional.empty();
    }

    private Path imagesDirectory(String chatId) {
        if (chatId == null || chatId.isBlank()) {
            return historyRoot.resolve(TEMP_CHAT_DIR).resolve(IMAGES_DIR);
        }
        String chatFolder = chatId.endsWith(HISTORY_FILE_SUFFIX)
            ? chatId.substring(0, chatId.length() - HISTORY_FILE_SUFFIX.length())
            : chatId;
        return historyRoot.resolve(fileOperations.safeName(chatFolder)).resolve(IMAGES_DIR);
    }

    private static Path fileNameOf(Path sourcePath) {
        Path fileName = sourcePath.getFileName();
        return fileName == null ? sourcePath : fileName;
    }
}
