package com.williamcallahan.chatblocks.web;

/**
 * Request body for message parsing.
 *
 * @param text the raw message to parse
 */
public record MessageParseRequest(String text) {

    /**
     * Returns the message text, or an empty string when absent.
     */
    public String messageText() {
        return text != null ? text : "";
    }
}
