package com.williamcallahan.chatblocks.service;

import com.williamcallahan.chatblocks.config.AppProperties;
import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.ParsedMessage;
import com.williamcallahan.chatblocks.service.parsing.MessageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Parses chat messages into content blocks for the rendering client.
 */
@Service
public class MessageParsingService {

    private static final Logger logger = LoggerFactory.getLogger(MessageParsingService.class);

    private final MessageParser messageParser;
    private final int maxInputLength;

    /**
     * Creates the service around the shared parser.
     *
     * @param messageParser configured parser
     * @param appProperties parser limits
     */
    public MessageParsingService(MessageParser messageParser, AppProperties appProperties) {
        this.messageParser = messageParser;
        this.maxInputLength = appProperties.getParser().getMaxInputLength();
    }

    /**
     * Parses one message.
     *
     * @param message raw message body; null is treated as empty
     * @return parsed blocks with timing
     * @throws IllegalArgumentException when the message exceeds the configured length
     */
    public ParsedMessage parse(String message) {
        String body = message == null ? "" : message;
        if (body.length() > maxInputLength) {
            logger.warn("Message input exceeds maximum length: {} > {}", body.length(), maxInputLength);
            throw new IllegalArgumentException(
                "Message is too long: " + body.length() + " characters (limit " + maxInputLength + ")");
        }

        long startTime = System.currentTimeMillis();
        List<ContentBlock> blocks = messageParser.parse(body);
        long processingTime = System.currentTimeMillis() - startTime;

        logger.debug("Parsed message of length {} into {} blocks in {}ms",
            body.length(), blocks.size(), processingTime);
        return new ParsedMessage(blocks, processingTime);
    }
}
