package org.lite.ai.exception;

/**
 * Base type for errors surfaced by the AI gateway to its callers.
 */
public abstract class AiGatewayException extends RuntimeException {

    protected AiGatewayException(String message) {
        super(message);
    }

    protected AiGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable error code used in REST error bodies.
     */
    public abstract String getCode();
}
