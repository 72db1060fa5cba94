package com.williamcallahan.chatlatex.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Centralized file handling for export working directories, debug copies and cached bitmaps.
 */
@Service
public class FileOperationsService {

    private static final Logger logger = LoggerFactory.getLogger(FileOperationsService.class);

    /**
     * Saves text content to a file, creating parent directories as needed.
     *
     * @param filePath The path to the file
     * @param content The text content to write
     * @throws IOException If file operations fail
     */
    public void saveTextFile(Path filePath, String content) throws IOException {
        createDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Reads text content from a file.
     *
     * @param filePath The path to the file
     * @return The file content as a string
     * @throws IOException If file operations fail
     */
    public String readTextFile(Path filePath) throws IOException {
        return Files.readString(filePath, StandardCharsets.UTF_8);
    }

    /**
     * Writes bytes through a temporary sibling and moves it into place, so readers never see a
     * half-written file. Concurrent writers of the same path race; the last move wins.
     *
     * @param filePath destination
     * @param content bytes to write
     * @throws IOException If file operations fail
     */
    public void writeAtomically(Path filePath, byte[] content) throws IOException {
        createDirectories(filePath);
        Path tempFile = Files.createTempFile(filePath.getParent(), filePath.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFile, content);
            moveReplacing(tempFile, filePath);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Moves a file over its destination, atomically where the file system allows it.
     *
     * @param source file to move
     * @param destination target path, replaced when present
     * @throws IOException If file operations fail
     */
    public void moveReplacing(Path source, Path destination) throws IOException {
        createDirectories(destination);
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException atomicMoveException) {
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Checks if a file exists.
     *
     * @param filePath The path to check
     * @return true if the file exists, false otherwise
     */
    public boolean fileExists(Path filePath) {
        return Files.exists(filePath);
    }

    /**
     * Creates all necessary parent directories for a file path.
     *
     * @param filePath The file path for which to create directories
     * @throws IOException If directory creation fails
     */
    public void createDirectories(Path filePath) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Deletes every regular file directly inside a directory whose name matches a glob.
     *
     * @param directory directory to clean, ignored when missing
     * @param glob file name pattern such as {@code formula_*.png}
     * @return number of files deleted
     * @throws IOException If listing or deleting fails
     */
    public int deleteMatching(Path directory, String glob) throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> matches = Files.newDirectoryStream(directory, glob)) {
            for (Path match : matches) {
                if (Files.isRegularFile(match) && Files.deleteIfExists(match)) {
                    deleted++;
                }
            }
        }
        return deleted;
    }

    /**
     * Deletes a directory tree. Failures are logged; a leftover temp directory is not an error.
     *
     * @param directory directory to remove
     */
    public void deleteRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException deleteException) {
                    logger.debug("Could not delete {}: {}", path, deleteException.getMessage());
                }
            });
        } catch (IOException walkException) {
            logger.warn("Could not clean up {}: {}", directory, walkException.getMessage());
        }
    }

    /**
     * Safely converts a chat id or title to a filesystem-safe name.
     *
     * @param name The name to convert
     * @return A filesystem-safe filename
     */
    public String safeName(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
