package com.autonomous.gateway.provider;

import lombok.Getter;

/**
 * Classified failure raised by a {@link ProviderAdapter}.
 */
@Getter
public class ProviderException extends RuntimeException {

    public enum Kind {
        RETRYABLE,
        RATE_LIMITED,
        FATAL
    }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }
}
