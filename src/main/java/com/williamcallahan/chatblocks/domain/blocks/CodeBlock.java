package com.williamcallahan.chatblocks.domain.blocks;

import java.util.Objects;

/**
 * Contents of a fenced code block.
 *
 * @param body newline-joined code lines with the fence indentation removed
 * @param language tag following the opening fence, or null when the fence has none
 * @param indent number of leading characters stripped from every body line
 */
public record CodeBlock(String body, String language, int indent) implements ContentBlock {

    public CodeBlock {
        Objects.requireNonNull(body, "Code body cannot be null");
        if (indent < 0) {
            throw new IllegalArgumentException("Indent cannot be negative: " + indent);
        }
    }
}
