package com.williamcallahan.chatblocks.domain.blocks;

import java.util.Objects;

/**
 * Model reasoning wrapped in {@code <think>} tags.
 *
 * @param content trimmed text between the tags
 * @param expanded UI disclosure state; parsing always produces collapsed blocks
 */
public record ThinkingBlock(String content, boolean expanded) implements ContentBlock {

    public ThinkingBlock {
        Objects.requireNonNull(content, "Thinking content cannot be null");
    }

    /**
     * Creates a collapsed thinking block.
     *
     * @param content trimmed reasoning text
     * @return block with {@code expanded} set to false
     */
    public static ThinkingBlock collapsed(String content) {
        return new ThinkingBlock(content, false);
    }

    /**
     * Returns a copy with the given disclosure state.
     *
     * @param expandedState new disclosure state
     * @return copy of this block
     */
    public ThinkingBlock withExpanded(boolean expandedState) {
        return new ThinkingBlock(content, expandedState);
    }
}
