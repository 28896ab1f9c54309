package com.williamcallahan.chatblocks.web;

import com.williamcallahan.chatblocks.domain.images.ImageResource;

/**
 * JSON payload returned after storing an image.
 *
 * @param status fixed "success" indicator
 * @param id identifier to embed as {@code <image-uuid>id</image-uuid>}
 * @param mediaType stored media type
 * @param sizeBytes payload size
 */
public record ImageUploadResponse(String status, String id, String mediaType, long sizeBytes)
        implements ApiResponse {

    static ImageUploadResponse from(ImageResource resource) {
        return new ImageUploadResponse("success", resource.id().toString(), resource.mediaType(), resource.sizeBytes());
    }
}
