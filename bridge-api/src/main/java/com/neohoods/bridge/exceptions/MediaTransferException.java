package com.neohoods.bridge.exceptions;

/**
 * An attachment could not be fetched from its source URL.
 */
public class MediaTransferException extends RuntimeException {

    public MediaTransferException(String message) {
        super(message);
    }

    public MediaTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
