package com.williamcallahan.chatblocks.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of parser and image settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMaxInputLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getParser().setMaxInputLength(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsMissingLineRouting() {
        AppProperties appProperties = new AppProperties();
        appProperties.getParser().setLineRouting(null);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsBlankImageDirectory() {
        AppProperties appProperties = new AppProperties();
        appProperties.getImages().setDirectory(" ");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveImageLimits() {
        AppProperties appProperties = new AppProperties();
        appProperties.getImages().setMaxBytes(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
