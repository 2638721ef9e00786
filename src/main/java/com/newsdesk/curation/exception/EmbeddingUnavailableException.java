package com.newsdesk.curation.exception;

public class EmbeddingUnavailableException extends CurationException {
    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
