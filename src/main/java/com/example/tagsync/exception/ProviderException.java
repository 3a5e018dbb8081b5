package com.example.tagsync.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure reported by the external metadata provider, classified by kind.
 */
public class ProviderException extends Exception {

    private final ProviderErrorKind kind;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private ProviderException(ProviderErrorKind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public static ProviderException rateLimited(Duration retryAfter) {
        return new ProviderException(ProviderErrorKind.RATE_LIMITED,
                "Rate limited, retry after " + retryAfter.toSeconds() + "s", retryAfter, null);
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRateLimited() {
        return kind == ProviderErrorKind.RATE_LIMITED;
    }
}
