package com.williamcallahan.chatblocks.service.parsing;

/**
 * Context-free category of a single message line.
 */
public enum LineCategory {
    /** Line starting with {@code <think>}. */
    THINKING,
    /** Line starting with a triple-backtick fence. */
    CODE_FENCE,
    /** Line whose first non-blank character is a pipe. */
    TABLE_ROW,
    /** A bare {@code \[} opener with nothing else on the line. */
    MATH_BLOCK_OPEN,
    /** A {@code \[} opener carrying content, or a {@code \]} closer. */
    MATH_LINE,
    /** Line starting with an {@code <image-uuid>} tag. */
    IMAGE_REFERENCE,
    TEXT
}
