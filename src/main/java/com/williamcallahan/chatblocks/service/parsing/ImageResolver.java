package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.images.ImageResource;

import java.util.Optional;
import java.util.UUID;

/**
 * Looks up the image behind an {@code <image-uuid>} reference.
 *
 * <p>A miss returns an empty Optional. The parser also treats a thrown exception as a miss
 * and keeps the reference line as text.</p>
 */
@FunctionalInterface
public interface ImageResolver {

    /**
     * Resolves an image identifier.
     *
     * @param imageId identifier parsed from the reference tag
     * @return the image, or empty when it is unknown
     */
    Optional<ImageResource> resolve(UUID imageId);

    /**
     * Returns a resolver that knows no images.
     */
    static ImageResolver none() {
        return imageId -> Optional.empty();
    }
}
