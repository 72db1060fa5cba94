package com.williamcallahan.chatlatex.domain.latex;

/**
 * Kinds of protected regions a plain text segment can contain.
 *
 * <p>The enum name is the {@code KIND} part of a {@code @@KIND_n@@} placeholder.</p>
 */
public enum RegionKind {
    /** Input text that already looks like a placeholder, rendered escaped. */
    LITERAL,
    /** Whitelisted LaTeX commands and already-escaped characters passed through verbatim. */
    LATEXCMD,
    DISPLAYMATH,
    INLINEMATH,
    INLINECODE,
    IMAGE,
    HEADER
}
