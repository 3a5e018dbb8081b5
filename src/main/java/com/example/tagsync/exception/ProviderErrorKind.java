package com.example.tagsync.exception;

public enum ProviderErrorKind {
    /** Provider asked us to slow down (HTTP 429). */
    RATE_LIMITED,
    NOT_FOUND,
    AUTH,
    NETWORK,
    PARSE,
    OTHER
}
