package com.williamcallahan.chatblocks.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.chatblocks.config.AppProperties;
import com.williamcallahan.chatblocks.domain.images.ImageResource;
import com.williamcallahan.chatblocks.domain.images.StoredImage;
import com.williamcallahan.chatblocks.service.parsing.ImageResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * File-backed store for images attached to chat messages.
 *
 * <p>Each image is kept as {@code <id>.bin} with its media type in {@code <id>.type}.
 * Metadata lookups used while parsing messages go through a Caffeine cache so repeated
 * renders of the same conversation do not touch the disk.</p>
 */
@Service
public class ImageStore implements ImageResolver {

    private static final Logger logger = LoggerFactory.getLogger(ImageStore.class);
    private static final String DATA_SUFFIX = ".bin";
    private static final String TYPE_SUFFIX = ".type";
    private static final String IMAGE_MEDIA_PREFIX = "image/";

    private final Path directory;
    private final long maxBytes;
    private final Cache<UUID, ImageResource> metadataCache;

    /**
     * Creates the store rooted at the configured directory.
     *
     * @param appProperties image settings
     */
    public ImageStore(AppProperties appProperties) {
        AppProperties.Images images = appProperties.getImages();
        this.directory = Paths.get(images.getDirectory()).toAbsolutePath().normalize();
        this.maxBytes = images.getMaxBytes();
        this.metadataCache = Caffeine.newBuilder()
            .maximumSize(images.getCacheMaxEntries())
            .recordStats()
            .build();
        logger.info("ImageStore initialized at {}", directory);
    }

    /**
     * Stores an image under a new identifier.
     *
     * @param data raw image bytes
     * @param mediaType media type of the payload, must be {@code image/*}
     * @return metadata of the stored image
     * @throws IllegalArgumentException when the payload is empty, too large or not an image
     */
    public ImageResource store(byte[] data, String mediaType) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Image payload is empty");
        }
        if (data.length > maxBytes) {
            throw new IllegalArgumentException("Image payload exceeds " + maxBytes + " bytes");
        }
        String normalizedType = normalizeMediaType(mediaType);

        UUID id = UUID.randomUUID();
        try {
            Files.createDirectories(directory);
            Files.write(dataPath(id), data);
            Files.writeString(typePath(id), normalizedType, StandardCharsets.UTF_8);
        } catch (IOException ioException) {
            throw new ImageStorageException("Failed to store image " + id, ioException);
        }

        ImageResource resource = new ImageResource(id, normalizedType, data.length);
        metadataCache.put(id, resource);
        logger.debug("Stored image {} ({} bytes, {})", id, data.length, normalizedType);
        return resource;
    }

    /**
     * Resolves image metadata for a reference found in a message.
     *
     * @param imageId image identifier
     * @return metadata, or empty when no such image is stored
     */
    @Override
    public Optional<ImageResource> resolve(UUID imageId) {
        ImageResource cached = metadataCache.getIfPresent(imageId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ImageResource> loaded = readMetadata(imageId);
        loaded.ifPresent(resource -> metadataCache.put(imageId, resource));
        return loaded;
    }

    /**
     * Loads the bytes of a stored image.
     *
     * @param imageId image identifier
     * @return bytes and metadata, or empty when no such image is stored
     */
    public Optional<StoredImage> load(UUID imageId) {
        Optional<ImageResource> resource = resolve(imageId);
        if (resource.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StoredImage(resource.get(), Files.readAllBytes(dataPath(imageId))));
        } catch (IOException ioException) {
            throw new ImageStorageException("Failed to read image " + imageId, ioException);
        }
    }

    /**
     * Drops cached metadata; stored files are untouched.
     */
    public void clearCache() {
        metadataCache.invalidateAll();
    }

    /**
     * Number of metadata entries currently cached.
     */
    public long cachedEntryCount() {
        metadataCache.cleanUp();
        return metadataCache.estimatedSize();
    }

    private Optional<ImageResource> readMetadata(UUID imageId) {
        Path dataPath = dataPath(imageId);
        if (!Files.isRegularFile(dataPath)) {
            return Optional.empty();
        }
        try {
            Path typePath = typePath(imageId);
            String mediaType = Files.isRegularFile(typePath)
                ? Files.readString(typePath, StandardCharsets.UTF_8).strip()
                : "application/octet-stream";
            return Optional.of(new ImageResource(imageId, mediaType, Files.size(dataPath)));
        } catch (IOException ioException) {
            throw new ImageStorageException("Failed to read metadata for image " + imageId, ioException);
        }
    }

    private static String normalizeMediaType(String mediaType) {
        if (mediaType == null || mediaType.isBlank()) {
            throw new IllegalArgumentException("Image media type is required");
        }
        String normalized = mediaType.strip().toLowerCase(Locale.ROOT);
        int parameterIndex = normalized.indexOf(';');
        if (parameterIndex >= 0) {
            normalized = normalized.substring(0, parameterIndex).strip();
        }
        if (!normalized.startsWith(IMAGE_MEDIA_PREFIX) || normalized.length() == IMAGE_MEDIA_PREFIX.length()) {
            throw new IllegalArgumentException("Unsupported image media type: " + mediaType);
        }
        return normalized;
    }

    private Path dataPath(UUID imageId) {
        return directory.resolve(imageId + DATA_SUFFIX);
    }

    private Path typePath(UUID imageId) {
        return directory.resolve(imageId + TYPE_SUFFIX);
    }
}
