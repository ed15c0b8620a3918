package org.lite.ai.exception;

public class TaskNotFoundException extends AiGatewayException {

    public TaskNotFoundException(String taskId) {
        super(String.format("Suggestion task '%s' not found", taskId));
    }

    @Override
    public String getCode() {
        return "TASK_NOT_FOUND";
    }
}
