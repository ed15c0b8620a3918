package org.lite.ai.exception;

import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import lombok.Getter;
import org.lite.ai.enums.ProviderFailureKind;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A single failed provider attempt. Stays inside the router; callers only ever see
 * {@link GenerationFailedException} carrying the last one as its cause.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String provider;
    private final ProviderFailureKind kind;
    private final Duration retryAfter;

    public ProviderException(String provider, ProviderFailureKind kind, String message) {
        this(provider, kind, message, null, null);
    }

    public ProviderException(String provider, ProviderFailureKind kind, String message, Duration retryAfter, Throwable cause) {
        super(String.format("[%s] %s: %s", provider, kind, message), cause);
        this.provider = provider;
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    public static ProviderException invalidResponse(String provider, String message) {
        return new ProviderException(provider, ProviderFailureKind.INVALID_RESPONSE, message);
    }

    /**
     * Maps an arbitrary error raised while calling a provider onto the failure taxonomy.
     */
    public static ProviderException classify(String provider, Throwable error) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            if (isTimeout(root)) {
                break;
            }
            root = root.getCause();
        }
        if (isTimeout(root) || isTimeout(error)) {
            return new ProviderException(provider, ProviderFailureKind.TIMEOUT, String.valueOf(error.getMessage()), null, error);
        }
        if (error instanceof WebClientRequestException || root instanceof ConnectException) {
            // connection-level failures are transient from the caller's point of view
            return new ProviderException(provider, ProviderFailureKind.TIMEOUT, String.valueOf(error.getMessage()), null, error);
        }
        return new ProviderException(provider, ProviderFailureKind.INVALID_RESPONSE, String.valueOf(error.getMessage()), null, error);
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof TimeoutException || t instanceof ReadTimeoutException || t instanceof WriteTimeoutException;
    }
}
