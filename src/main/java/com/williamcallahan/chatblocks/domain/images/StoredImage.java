package com.williamcallahan.chatblocks.domain.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Image bytes loaded from the store together with their metadata.
 *
 * @param resource image metadata
 * @param data raw image bytes
 */
public record StoredImage(ImageResource resource, byte[] data) {

    public StoredImage {
        Objects.requireNonNull(resource, "Image resource is required");
        Objects.requireNonNull(data, "Image data is required");
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StoredImage that
            && resource.equals(that.resource)
            && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * resource.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "StoredImage[resource=" + resource + ", data=" + data.length + " bytes]";
    }
}
