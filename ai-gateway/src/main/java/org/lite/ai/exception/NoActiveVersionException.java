package org.lite.ai.exception;

/**
 * Search was issued for an embedding model that has no active knowledge-base version.
 */
public class NoActiveVersionException extends AiGatewayException {

    public NoActiveVersionException(String embeddingModel) {
        super(String.format("No active knowledge-base version for embedding model '%s'", embeddingModel));
    }

    @Override
    public String getCode() {
        return "NO_ACTIVE_VERSION";
    }
}
