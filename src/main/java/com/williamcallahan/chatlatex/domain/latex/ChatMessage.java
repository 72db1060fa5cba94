package com.williamcallahan.chatlatex.domain.latex;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single chat message as stored in conversation history.
 *
 * @param role role tag as written by the chat client ("user", "assistant", ...)
 * @param content raw message text in the extended markdown dialect
 */
public record ChatMessage(String role, String content) {

    /**
     * Creates a message while normalizing missing fields to empty strings.
     *
     * @param role role tag
     * @param content message text
     * @return normalized message
     */
    @JsonCreator
    public static ChatMessage create(@JsonProperty("role") String role, @JsonProperty("content") String content) {
        return new ChatMessage(role == null ? "" : role, content == null ? "" : content);
    }

    public ChatMessage {
        Objects.requireNonNull(role, "Message role cannot be null");
        Objects.requireNonNull(content, "Message content cannot be null");
    }

    /**
     * Resolves the role tag into a {@link MessageRole}.
     */
    public MessageRole messageRole() {
        return MessageRole.fromToken(role);
    }
}
