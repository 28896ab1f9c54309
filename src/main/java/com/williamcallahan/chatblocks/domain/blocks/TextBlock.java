package com.williamcallahan.chatblocks.domain.blocks;

import java.util.Objects;

/**
 * Literal prose, either a single scanned line fragment or several newline-joined lines.
 *
 * @param body the text exactly as it appeared in the message
 */
public record TextBlock(String body) implements ContentBlock {

    public TextBlock {
        Objects.requireNonNull(body, "Text body cannot be null");
    }
}
