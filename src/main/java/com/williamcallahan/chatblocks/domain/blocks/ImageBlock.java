package com.williamcallahan.chatblocks.domain.blocks;

import com.williamcallahan.chatblocks.domain.images.ImageResource;

import java.util.Objects;

/**
 * An inline image whose reference was resolved against the image store.
 *
 * @param image resolved image metadata
 */
public record ImageBlock(ImageResource image) implements ContentBlock {

    public ImageBlock {
        Objects.requireNonNull(image, "Image resource cannot be null");
    }
}
