package fun.fengwk.a11y.core.service.queue;

/**
 * Exception thrown when a task does not reach a terminal state in time.
 */
public class TaskTimeoutException extends RuntimeException {

    public TaskTimeoutException(String message) {
        super(message);
    }

    public TaskTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
