package com.williamcallahan.chatlatex.domain.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MessageRoleTest {

    @Test
    void parsesCaseInsensitively() {
        assertEquals(MessageRole.USER, MessageRole.fromToken(" User "));
        assertEquals(MessageRole.SYSTEM, MessageRole.fromToken("SYSTEM"));
        assertEquals(MessageRole.TOOL, MessageRole.fromToken("tool"));
    }

    @Test
    void unknownRolesAreStyledAsAssistant() {
        assertEquals(MessageRole.ASSISTANT, MessageRole.fromToken("narrator"));
        assertEquals(MessageRole.ASSISTANT, MessageRole.fromToken(null));
        assertEquals("usercolor", MessageRole.USER.colorName());
        assertEquals("assistantcolor", MessageRole.fromToken("narrator").colorName());
    }
}
