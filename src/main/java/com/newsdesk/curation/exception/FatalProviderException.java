package com.newsdesk.curation.exception;

/** Authentication, permission or quota failure. Aborts the remaining batch. */
public class FatalProviderException extends CurationException {
    public FatalProviderException(String message) {
        super(message);
    }

    public FatalProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
