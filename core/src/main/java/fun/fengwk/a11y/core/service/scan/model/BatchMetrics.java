package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

/**
 * Summary metrics of one batch run.
 *
 * @author fengwk
 */
@Data
@Builder
public class BatchMetrics {

    private long totalTime;
    private double averageTimePerPage;

    /**
     * Percentage in [0, 100].
     */
    private double successRate;

}
