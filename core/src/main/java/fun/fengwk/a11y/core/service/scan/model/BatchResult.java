package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Aggregate outcome of a batch run.
 *
 * @author fengwk
 */
@Data
@Builder
public class BatchResult {

    private List<AnalysisResult> successful;
    private List<PageFailure> failed;
    private BatchMetrics metrics;

}
