package com.newsdesk.curation.exception;

/**
 * Base type for failures raised by the curation pipeline and its provider client.
 */
public class CurationException extends RuntimeException {
    public CurationException(String message) {
        super(message);
    }

    public CurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
