package com.williamcallahan.chatblocks.domain.blocks;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A typed unit of a parsed chat message that can be rendered independently.
 *
 * <p>The union is closed: a renderer handling every permitted record handles every
 * message. Serialized JSON carries a {@code type} discriminator.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextBlock.class, name = "text"),
    @JsonSubTypes.Type(value = CodeBlock.class, name = "code"),
    @JsonSubTypes.Type(value = TableBlock.class, name = "table"),
    @JsonSubTypes.Type(value = FormulaBlock.class, name = "formula"),
    @JsonSubTypes.Type(value = ThinkingBlock.class, name = "thinking"),
    @JsonSubTypes.Type(value = ImageBlock.class, name = "image")
})
public sealed interface ContentBlock
    permits TextBlock, CodeBlock, TableBlock, FormulaBlock, ThinkingBlock, ImageBlock {
}
