package com.williamcallahan.chatlatex.domain.latex;

/**
 * Classifies a chunk of a chat message for the LaTeX pipeline.
 */
public enum SegmentKind {
    CODE_BLOCK,
    TABLE,
    HORIZONTAL_RULE,
    PLAIN_TEXT
}
