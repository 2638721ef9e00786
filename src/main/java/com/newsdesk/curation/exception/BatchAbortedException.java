package com.newsdesk.curation.exception;

/** A provider call not sent because its batch was aborted by an earlier fatal error. */
public class BatchAbortedException extends CurationException {
    public BatchAbortedException(String message) {
        super(message);
    }
}
