package com.williamcallahan.chatblocks.web;

import com.williamcallahan.chatblocks.domain.blocks.ParsedMessage;
import com.williamcallahan.chatblocks.service.MessageParsingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller that turns raw chat messages into renderable content blocks.
 */
@RestController
@RequestMapping("/api/messages")
public class MessageController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MessageController.class);

    private final MessageParsingService messageParsingService;

    public MessageController(MessageParsingService messageParsingService,
                             ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.messageParsingService = messageParsingService;
    }

    /**
     * Parses a message into content blocks.
     *
     * @param request A JSON object containing the message. Expected format:
     *                <pre>{@code
     *                  {
     *                    "text": "Hello $x^2$ world"
     *                  }
     *                }</pre>
     * @return the parsed blocks on success, for example
     *         <pre>{@code {"status": "success", "blocks": [{"type": "text", "body": "Hello "}, ...]}}</pre>
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> parse(@RequestBody MessageParseRequest request) {
        try {
            String text = request == null ? "" : request.messageText();
            logger.debug("Parsing message of length: {}", text.length());

            ParsedMessage parsed = messageParsingService.parse(text);
            return ResponseEntity.ok(MessageParseResponse.from(parsed));
        } catch (IllegalArgumentException validationException) {
            return handleValidationException(validationException);
        } catch (RuntimeException parseFailure) {
            logger.error("Error parsing message", parseFailure);
            return handleServiceException(parseFailure, "parse message");
        }
    }
}
