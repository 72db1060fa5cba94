package com.williamcallahan.chatlatex.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.chatlatex.domain.latex.ChatMessage;
import com.williamcallahan.chatlatex.domain.latex.ConversationExportRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a saved conversation ({@code {"messages": [...], "metadata": {"title": ...}}}) into an
 * export request. The chat id is the file name without its {@code .json} suffix.
 */
@Service
public class ConversationHistoryReader {

    private static final String HISTORY_FILE_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final FileOperationsService fileOperations;

    public ConversationHistoryReader(ObjectMapper objectMapper, FileOperationsService fileOperations) {
        this.objectMapper = objectMapper;
        this.fileOperations = fileOperations;
    }

    /**
     * Loads a history file.
     *
     * @param historyFile saved conversation
     * @param titleOverride title to use instead of the stored one, null or blank to keep it
     * @return export request for the conversation
     * @throws IOException when the file cannot be read or is not a conversation
     */
    public ConversationExportRequest read(Path historyFile, String titleOverride) throws IOException {
        JsonNode root = objectMapper.readTree(fileOperations.readTextFile(historyFile));
        if (root == null || !root.isObject()) {
            throw new IOException("Not a saved conversation: " + historyFile);
        }
        List<ChatMessage> messages = new ArrayList<>();
        for (JsonNode messageNode : root.path("messages")) {
            messages.add(ChatMessage.create(textOf(messageNode.get("role")), textOf(messageNode.get("content"))));
        }
        String title = titleOverride == null || titleOverride.isBlank()
            ? textOf(root.path("metadata").get("title"))
            : titleOverride;
        return ConversationExportRequest.create(title, chatIdOf(historyFile), messages);
    }

    static String chatIdOf(Path historyFile) {
        String fileName = historyFile.getFileName().toString();
        return fileName.endsWith(HISTORY_FILE_SUFFIX)
            ? fileName.substring(0, fileName.length() - HISTORY_FILE_SUFFIX.length())
            : fileName;
    }

    private static String textOf(JsonNode node) {
        return node == null || !node.isTextual() ? "" : node.asText();
    }
}
