package org.lite.ai.exception;

/**
 * Another actor already performed (or is performing) the requested version transition.
 */
public class VersionConflictException extends AiGatewayException {

    public VersionConflictException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "VERSION_CONFLICT";
    }
}
