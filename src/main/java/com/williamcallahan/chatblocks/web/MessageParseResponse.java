package com.williamcallahan.chatblocks.web;

import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.ParsedMessage;

import java.util.List;

/**
 * JSON payload listing the blocks of a parsed message.
 *
 * @param status fixed "success" indicator
 * @param blocks blocks in message order, each with a {@code type} discriminator
 * @param blockCount number of blocks
 * @param processingTimeMs parse duration
 */
public record MessageParseResponse(String status,
                                   List<ContentBlock> blocks,
                                   int blockCount,
                                   long processingTimeMs) implements ApiResponse {

    public MessageParseResponse {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    static MessageParseResponse from(ParsedMessage parsed) {
        return new MessageParseResponse("success", parsed.blocks(), parsed.blockCount(), parsed.processingTimeMs());
    }
}
