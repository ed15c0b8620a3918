package org.lite.ai.exception;

import lombok.Getter;

/**
 * Thrown when every provider attempt for a completion or embedding call has been exhausted.
 * The cause is the last underlying {@link ProviderException}.
 */
@Getter
public class GenerationFailedException extends AiGatewayException {

    private final int attempts;

    public GenerationFailedException(String message, int attempts, Throwable lastCause) {
        super(message, lastCause);
        this.attempts = attempts;
    }

    @Override
    public String getCode() {
        return "GENERATION_FAILED";
    }
}
