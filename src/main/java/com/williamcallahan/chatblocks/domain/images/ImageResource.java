package com.williamcallahan.chatblocks.domain.images;

import java.util.Objects;
import java.util.UUID;

/**
 * Metadata of an image that an {@code <image-uuid>} reference resolved to.
 * The bytes are served separately by the image endpoint.
 *
 * @param id image identifier
 * @param mediaType stored media type, for example {@code image/png}
 * @param sizeBytes payload size
 */
public record ImageResource(UUID id, String mediaType, long sizeBytes) {

    public ImageResource {
        Objects.requireNonNull(id, "Image id is required");
        Objects.requireNonNull(mediaType, "Media type is required");
    }
}
