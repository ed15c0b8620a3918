package org.lite.ai.exception;

/**
 * Raised inside a running task once its cancellation has been requested.
 */
public class TaskCancelledException extends AiGatewayException {

    public static final String MESSAGE = "Task cancelled";

    public TaskCancelledException() {
        super(MESSAGE);
    }

    @Override
    public String getCode() {
        return "TASK_CANCELLED";
    }
}
