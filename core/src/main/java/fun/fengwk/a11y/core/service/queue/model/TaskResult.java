package fun.fengwk.a11y.core.service.queue.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one execution attempt.
 *
 * @author fengwk
 */
@Data
@Builder
public class TaskResult {

    private String taskId;
    private String workerId;
    private boolean success;
    private TaskOutput output;
    private Throwable error;

    /**
     * Attempt duration in millis.
     */
    private long duration;

    private long memoryUsage;
    private WorkerMetrics workerMetrics;

}
