package fun.fengwk.a11y.core.service.queue;

/**
 * Exception thrown when a task ran to the end without producing a usable analysis.
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message) {
        super(message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
