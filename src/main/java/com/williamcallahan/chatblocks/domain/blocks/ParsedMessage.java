package com.williamcallahan.chatblocks.domain.blocks;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one chat message into content blocks.
 *
 * @param blocks blocks in message order
 * @param processingTimeMs time taken to parse the message
 */
public record ParsedMessage(List<ContentBlock> blocks, long processingTimeMs) {

    public ParsedMessage {
        Objects.requireNonNull(blocks, "Blocks list cannot be null");
        blocks = List.copyOf(blocks);
    }

    /**
     * Gets the total number of blocks.
     * @return block count
     */
    public int blockCount() {
        return blocks.size();
    }

    /**
     * Counts the blocks of a single kind.
     *
     * @param blockType block record class to count
     * @return number of blocks of that type
     */
    public long countOf(Class<? extends ContentBlock> blockType) {
        return blocks.stream().filter(blockType::isInstance).count();
    }
}
