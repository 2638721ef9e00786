package com.newsdesk.curation.exception;

/**
 * The provider answered, but the answer cannot be used for this article (unparsable or out-of-range
 * fields, or a request the provider rejects as invalid). Not retried.
 */
public class MalformedResponseException extends CurationException {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
