package com.williamcallahan.chatblocks.domain.blocks;

import java.util.Objects;

/**
 * LaTeX source of a display block or an inline span, delimiters removed.
 *
 * @param content formula source; may be empty or whitespace only
 */
public record FormulaBlock(String content) implements ContentBlock {

    public FormulaBlock {
        Objects.requireNonNull(content, "Formula content cannot be null");
    }
}
