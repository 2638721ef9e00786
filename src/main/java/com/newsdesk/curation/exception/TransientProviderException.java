package com.newsdesk.curation.exception;

/** Timeout, 5xx or network failure. Retried a bounded number of times with backoff. */
public class TransientProviderException extends CurationException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
