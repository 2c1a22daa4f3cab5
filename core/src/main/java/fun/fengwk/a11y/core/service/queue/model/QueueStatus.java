package fun.fengwk.a11y.core.service.queue.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Point-in-time copy of the four task partitions.
 *
 * @author fengwk
 */
@Data
@Builder
public class QueueStatus {

    private List<AnalysisTask> pending;
    private List<AnalysisTask> processing;
    private List<AnalysisTask> completed;
    private List<AnalysisTask> failed;

}
