package com.newsdesk.curation.controller;

/** Missing or wrong {@code x-admin-key} on an endpoint that cannot return a plain 401 response entity. */
class UnauthorizedException extends RuntimeException {
    UnauthorizedException() {
        super("admin key required");
    }
}
