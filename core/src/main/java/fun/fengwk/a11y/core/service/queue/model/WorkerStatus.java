package fun.fengwk.a11y.core.service.queue.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Pool view of one worker.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerStatus {

    private String workerId;
    private boolean available;

    /**
     * Marked for removal by a scale-down, takes no new work.
     */
    private boolean retiring;

    private String currentTaskId;
    private Instant lastActivity;
    private WorkerMetrics metrics;

}
