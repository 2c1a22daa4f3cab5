package fun.fengwk.a11y.core.service.queue.model;

import lombok.Builder;
import lombok.Data;

/**
 * Cumulative counters of one worker.
 *
 * @author fengwk
 */
@Data
@Builder
public class WorkerMetrics {

    private int tasksProcessed;
    private double averageProcessingTime;

    /**
     * Used heap bytes at snapshot time.
     */
    private long memoryUsage;

    private double errorRate;
    private long uptime;

}
