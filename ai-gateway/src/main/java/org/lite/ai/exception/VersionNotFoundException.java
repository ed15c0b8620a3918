package org.lite.ai.exception;

public class VersionNotFoundException extends AiGatewayException {

    public VersionNotFoundException(String version) {
        super(String.format("Knowledge-base version '%s' not found", version));
    }

    @Override
    public String getCode() {
        return "VERSION_NOT_FOUND";
    }
}
