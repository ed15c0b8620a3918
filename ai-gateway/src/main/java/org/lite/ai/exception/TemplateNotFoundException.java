package org.lite.ai.exception;

public class TemplateNotFoundException extends AiGatewayException {

    public TemplateNotFoundException(String name, String version) {
        super(version == null
                ? String.format("Prompt template '%s' not found", name)
                : String.format("Prompt template '%s' version '%s' not found", name, version));
    }

    @Override
    public String getCode() {
        return "TEMPLATE_NOT_FOUND";
    }
}
