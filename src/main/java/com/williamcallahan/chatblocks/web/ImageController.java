package com.williamcallahan.chatblocks.web;

import com.williamcallahan.chatblocks.domain.images.StoredImage;
import com.williamcallahan.chatblocks.service.ImageStore;
import com.williamcallahan.chatblocks.service.ImageStorageException;
import com.williamcallahan.chatblocks.service.parsing.ImageReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

/**
 * REST API for images referenced from chat messages via {@code <image-uuid>} tags.
 */
@RestController
@RequestMapping("/api/images")
public class ImageController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ImageController.class);

    private final ImageStore imageStore;

    public ImageController(ImageStore imageStore, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.imageStore = imageStore;
    }

    /**
     * POST /api/images - Stores the raw request body as an image
     */
    @PostMapping(consumes = MediaType.ALL_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> upload(@RequestBody byte[] data,
                                              @RequestHeader(HttpHeaders.CONTENT_TYPE) String contentType) {
        try {
            var stored = imageStore.store(data, contentType);
            log.info("Stored image {} ({} bytes)", stored.id(), stored.sizeBytes());
            return ResponseEntity.status(HttpStatus.CREATED).body(ImageUploadResponse.from(stored));
        } catch (IllegalArgumentException validationException) {
            return handleValidationException(validationException);
        } catch (ImageStorageException storageFailure) {
            log.error("Failed to store image", storageFailure);
            return handleServiceException(storageFailure, "store image");
        }
    }

    /**
     * GET /api/images/{id} - Returns the stored bytes with their media type
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> download(@PathVariable("id") String id) {
        Optional<UUID> imageId = ImageReferenceExtractor.parseCanonicalUuid(id);
        if (imageId.isEmpty()) {
            log.debug("Rejected image id {}", id);
            return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid image id: " + id);
        }
        try {
            Optional<StoredImage> image = imageStore.load(imageId.get());
            if (image.isEmpty()) {
                return ResponseEntity.notFound().build();
            }
            StoredImage storedImage = image.get();
            return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(storedImage.resource().mediaType()))
                .contentLength(storedImage.data().length)
                .body(storedImage.data());
        } catch (ImageStorageException | InvalidMediaTypeException loadFailure) {
            log.error("Failed to load image {}", id, loadFailure);
            return handleServiceException(loadFailure, "load image");
        }
    }
}
