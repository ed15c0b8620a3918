package org.lite.ai.enums;

/**
 * Classification of a single failed provider attempt.
 */
public enum ProviderFailureKind {
    TIMEOUT(true, false),
    RATE_LIMITED(true, false),
    AUTH_FAILED(false, true),
    INVALID_RESPONSE(true, true);

    private final boolean retryable;
    private final boolean fatal;

    ProviderFailureKind(boolean retryable, boolean fatal) {
        this.retryable = retryable;
        this.fatal = fatal;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Fatal kinds count towards the consecutive-error streak that takes a provider down.
     */
    public boolean isFatal() {
        return fatal;
    }
}
