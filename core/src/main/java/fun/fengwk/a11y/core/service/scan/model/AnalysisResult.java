package fun.fengwk.a11y.core.service.scan.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Findings of one page analysis.
 *
 * @author fengwk
 */
@Data
@Builder
public class AnalysisResult {

    private String url;
    private Instant timestamp;
    private String tool;
    private List<Violation> violations;
    private ViolationSummary summary;

}
