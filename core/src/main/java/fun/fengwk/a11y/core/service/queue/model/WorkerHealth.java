package fun.fengwk.a11y.core.service.queue.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * @author fengwk
 */
@Data
@Builder
public class WorkerHealth {

    private String workerId;
    private boolean healthy;
    private WorkerMetrics metrics;
    private Instant lastActivity;
    private String currentTaskId;

}
