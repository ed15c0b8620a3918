package org.lite.ai.exception;

import org.lite.ai.enums.KbVersionStatus;

public class InvalidVersionStateException extends AiGatewayException {

    public InvalidVersionStateException(String version, KbVersionStatus actual, String operation) {
        super(String.format("Cannot %s version '%s' in state %s", operation, version, actual));
    }

    public InvalidVersionStateException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_VERSION_STATE";
    }
}
