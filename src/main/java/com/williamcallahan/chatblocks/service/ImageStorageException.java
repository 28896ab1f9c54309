package com.williamcallahan.chatblocks.service;

/**
 * Signals a failure while reading or writing stored images.
 */
public class ImageStorageException extends IllegalStateException {

    /**
     * Creates an image storage exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public ImageStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
