package com.williamcallahan.chatlatex.domain.latex;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Describes a conversation to assemble into a LaTeX document or PDF.
 *
 * @param title optional document title, blank for none
 * @param chatId optional chat id used to resolve image paths
 * @param messages messages in conversation order
 */
public record ConversationExportRequest(String title, String chatId, List<ChatMessage> messages) {

    @JsonCreator
    public static ConversationExportRequest create(
        @JsonProperty("title") String title,
        @JsonProperty("chatId") String chatId,
        @JsonProperty("messages") List<ChatMessage> messages
    ) {
        return new ConversationExportRequest(title == null ? "" : title, chatId, messages == null ? List.of() : messages);
    }

    public ConversationExportRequest {
        Objects.requireNonNull(title, "Title cannot be null");
        Objects.requireNonNull(messages, "Messages cannot be null");
        messages = List.copyOf(messages);
    }
}
