package fun.fengwk.a11y.core.service.queue;

/**
 * Exception thrown when a task is handed to a worker that is already running one.
 */
public class WorkerBusyException extends IllegalStateException {

    public WorkerBusyException(String message) {
        super(message);
    }

}
