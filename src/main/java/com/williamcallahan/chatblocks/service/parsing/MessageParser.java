package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.images.ImageResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts a raw chat message into an ordered list of content blocks.
 *
 * <p>Recognizes fenced code, pipe tables, display and inline LaTeX, {@code <think>}
 * sections and {@code <image-uuid>} references. Malformed markup never fails the parse;
 * it degrades to text. Instances hold no per-call state and may be shared between threads
 * as long as the image resolver can be.</p>
 */
public final class MessageParser {

    private static final Logger logger = LoggerFactory.getLogger(MessageParser.class);
    private static final String LINE_SEPARATOR = "\n";

    private final ImageResolver imageResolver;
    private final LineRouting lineRouting;

    /**
     * Creates a parser that resolves no images and uses classifier-first routing.
     */
    public MessageParser() {
        this(ImageResolver.none(), LineRouting.CLASSIFIER_FIRST);
    }

    /**
     * Creates a parser with the given image resolver and classifier-first routing.
     *
     * @param imageResolver resolver for image references
     */
    public MessageParser(ImageResolver imageResolver) {
        this(imageResolver, LineRouting.CLASSIFIER_FIRST);
    }

    /**
     * Creates a parser.
     *
     * @param imageResolver resolver for image references
     * @param lineRouting how open blocks treat lines of other categories
     */
    public MessageParser(ImageResolver imageResolver, LineRouting lineRouting) {
        this.imageResolver = Objects.requireNonNull(imageResolver, "Image resolver is required");
        this.lineRouting = Objects.requireNonNull(lineRouting, "Line routing is required");
    }

    /**
     * Parses a message. Empty input yields a single empty text block.
     *
     * @param input raw message body; null is treated as empty
     * @return blocks in message order
     */
    public List<ContentBlock> parse(String input) {
        String message = input == null ? "" : input;
        BlockAssembler assembler = new BlockAssembler(lineRouting, this::lookupImage);
        for (String line : message.split(LINE_SEPARATOR, -1)) {
            assembler.accept(line);
        }
        return assembler.finish();
    }

    public LineRouting getLineRouting() {
        return lineRouting;
    }

    private Optional<ImageResource> lookupImage(UUID imageId) {
        try {
            Optional<ImageResource> resolved = imageResolver.resolve(imageId);
            return resolved == null ? Optional.empty() : resolved;
        } catch (RuntimeException resolverFailure) {
            logger.warn("Image resolver failed for {}, keeping reference as text: {}",
                imageId, resolverFailure.getMessage());
            return Optional.empty();
        }
    }
}
