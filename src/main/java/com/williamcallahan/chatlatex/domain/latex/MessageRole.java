package com.williamcallahan.chatlatex.domain.latex;

import com.williamcallahan.chatlatex.support.AsciiTextNormalizer;

/**
 * Author role of a chat message, controlling its header color in exported documents.
 */
public enum MessageRole {
    USER("user", "usercolor"),
    ASSISTANT("assistant", "assistantcolor"),
    SYSTEM("system", "assistantcolor"),
    TOOL("tool", "assistantcolor");

    private final String token;
    private final String colorName;

    MessageRole(String token, String colorName) {
        this.token = token;
        this.colorName = colorName;
    }

    public String token() {
        return token;
    }

    /**
     * Returns the name of the color defined in the document preamble for this role.
     */
    public String colorName() {
        return colorName;
    }

    /**
     * Parses a role tag case-insensitively; unknown tags are styled like the assistant.
     *
     * @param rawRole role tag from a stored conversation
     * @return matching role, never null
     */
    public static MessageRole fromToken(String rawRole) {
        String normalized = AsciiTextNormalizer.toLowerAscii(rawRole == null ? "" : rawRole.trim());
        for (MessageRole role : values()) {
            if (role.token.equals(normalized)) {
                return role;
            }
        }
        return ASSISTANT;
    }
}
