package com.williamcallahan.chatlatex.domain.latex;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts a single message body for conversion to a LaTeX fragment.
 *
 * @param content message text
 * @param chatId optional chat id used to resolve image paths
 */
public record LatexFragmentRequest(String content, String chatId) {

    @JsonCreator
    public static LatexFragmentRequest create(
        @JsonProperty("content") String content,
        @JsonProperty("chatId") String chatId
    ) {
        return new LatexFragmentRequest(content == null ? "" : content, chatId);
    }

    public LatexFragmentRequest {
        Objects.requireNonNull(content, "Fragment content cannot be null");
    }
}
