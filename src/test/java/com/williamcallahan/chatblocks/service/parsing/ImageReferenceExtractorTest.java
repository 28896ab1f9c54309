package com.williamcallahan.chatblocks.service.parsing;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageReferenceExtractorTest {

    private static final String ID = "123e4567-e89b-12d3-a456-426614174000";

    @Test
    void extractImageId_wellFormedTag_returnsId() {
        assertEquals(Optional.of(UUID.fromString(ID)),
            ImageReferenceExtractor.extractImageId("<image-uuid>" + ID + "</image-uuid>"));
    }

    @Test
    void extractImageId_upperCaseHex_isAccepted() {
        assertEquals(Optional.of(UUID.fromString(ID)),
            ImageReferenceExtractor.extractImageId("  <image-uuid>" + ID.toUpperCase() + "</image-uuid> caption"));
    }

    @Test
    void extractImageId_missingClosingTag_isEmpty() {
        assertTrue(ImageReferenceExtractor.extractImageId("<image-uuid>" + ID).isEmpty());
    }

    @Test
    void extractImageId_nonCanonicalId_isEmpty() {
        assertTrue(ImageReferenceExtractor.extractImageId("<image-uuid>1-2-3-4-5</image-uuid>").isEmpty());
        assertTrue(ImageReferenceExtractor.extractImageId("<image-uuid>not-a-uuid</image-uuid>").isEmpty());
        assertTrue(ImageReferenceExtractor.extractImageId("<image-uuid> " + ID + "</image-uuid>").isEmpty());
        assertTrue(ImageReferenceExtractor.parseCanonicalUuid("123e4567-e89b-12d3-a456-42661417400g").isEmpty());
    }
}
