package fun.fengwk.a11y.core.service.batch;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class AnalyzerStatus {

    private int maxConcurrency;
    private int activeSessions;

}
