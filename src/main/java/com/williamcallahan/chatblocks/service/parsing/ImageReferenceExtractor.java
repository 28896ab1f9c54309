package com.williamcallahan.chatblocks.service.parsing;

import java.util.Optional;
import java.util.UUID;

/**
 * Extracts the identifier from an {@code <image-uuid>...</image-uuid>} reference.
 */
public final class ImageReferenceExtractor {

    private static final int CANONICAL_UUID_LENGTH = 36;
    private static final int[] HYPHEN_POSITIONS = {8, 13, 18, 23};

    private ImageReferenceExtractor() {}

    /**
     * Reads the identifier between the first opening tag and the closing tag after it.
     *
     * @param line image reference line
     * @return the identifier, or empty when the tags are incomplete or the id is not a canonical UUID
     */
    static Optional<UUID> extractImageId(String line) {
        int openIndex = line.indexOf(LineClassifier.IMAGE_OPEN);
        if (openIndex < 0) {
            return Optional.empty();
        }
        int idStart = openIndex + LineClassifier.IMAGE_OPEN.length();
        int closeIndex = line.indexOf(LineClassifier.IMAGE_CLOSE, idStart);
        if (closeIndex < 0) {
            return Optional.empty();
        }
        return parseCanonicalUuid(line.substring(idStart, closeIndex));
    }

    /**
     * Parses an 8-4-4-4-12 hexadecimal identifier.
     * {@link UUID#fromString} alone also accepts shortened groups such as {@code 1-2-3-4-5}.
     *
     * @param candidate text that should hold an image id
     * @return the identifier, or empty when the text is not a canonical UUID
     */
    public static Optional<UUID> parseCanonicalUuid(String candidate) {
        if (candidate.length() != CANONICAL_UUID_LENGTH) {
            return Optional.empty();
        }
        int nextHyphen = 0;
        for (int index = 0; index < candidate.length(); index++) {
            char c = candidate.charAt(index);
            if (nextHyphen < HYPHEN_POSITIONS.length && index == HYPHEN_POSITIONS[nextHyphen]) {
                if (c != '-') {
                    return Optional.empty();
                }
                nextHyphen++;
            } else if (!isAsciiHexDigit(c)) {
                return Optional.empty();
            }
        }
        return Optional.of(UUID.fromString(candidate));
    }

    private static boolean isAsciiHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
