package com.williamcallahan.chatblocks.config;

import com.williamcallahan.chatblocks.service.ImageStore;
import com.williamcallahan.chatblocks.service.parsing.MessageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the message parser to the image store.
 */
@Configuration
public class ParserConfig {
    private static final Logger log = LoggerFactory.getLogger(ParserConfig.class);

    /**
     * Registers the shared parser; it is stateless between calls.
     *
     * @param imageStore resolver for image references
     * @param appProperties parser settings
     * @return configured parser
     */
    @Bean
    public MessageParser messageParser(ImageStore imageStore, AppProperties appProperties) {
        var routing = appProperties.getParser().getLineRouting();
        log.info("Message parser using {} line routing", routing);
        return new MessageParser(imageStore, routing);
    }
}
