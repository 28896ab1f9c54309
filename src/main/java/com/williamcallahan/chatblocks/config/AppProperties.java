package com.williamcallahan.chatblocks.config;

import com.williamcallahan.chatblocks.service.parsing.LineRouting;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private Parser parser = new Parser();
    private Images images = new Images();

    /**
     * Validates bound settings once at startup.
     */
    @PostConstruct
    public void validateConfiguration() {
        parser.validateConfiguration();
        images.validateConfiguration();
    }

    public Parser getParser() {
        return parser;
    }

    public void setParser(Parser parser) {
        this.parser = parser;
    }

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images;
    }

    private static void requirePositive(long value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public static class Parser {
        private LineRouting lineRouting = LineRouting.CLASSIFIER_FIRST;
        private int maxInputLength = 100_000;

        /**
         * Validates parser settings.
         */
        public void validateConfiguration() {
            if (lineRouting == null) {
                throw new IllegalArgumentException("app.parser.line-routing is required.");
            }
            requirePositive(maxInputLength, "app.parser.max-input-length");
        }

        public LineRouting getLineRouting() {
            return lineRouting;
        }

        public void setLineRouting(LineRouting lineRouting) {
            this.lineRouting = lineRouting;
        }

        public int getMaxInputLength() {
            return maxInputLength;
        }

        public void setMaxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
        }
    }

    public static class Images {
        private String directory = "data/images";
        private int cacheMaxEntries = 500;
        private long maxBytes = 10L * 1024 * 1024;

        public void validateConfiguration() {
            if (directory == null || directory.isBlank()) {
                throw new IllegalArgumentException("app.images.directory is required.");
            }
            requirePositive(cacheMaxEntries, "app.images.cache-max-entries");
            requirePositive(maxBytes, "app.images.max-bytes");
        }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public int getCacheMaxEntries() { return cacheMaxEntries; }
        public void setCacheMaxEntries(int cacheMaxEntries) { this.cacheMaxEntries = cacheMaxEntries; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
    }
}
