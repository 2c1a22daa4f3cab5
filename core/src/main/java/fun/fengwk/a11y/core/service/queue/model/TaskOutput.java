package fun.fengwk.a11y.core.service.queue.model;

import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.PageFailure;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Payload produced by a task execution.
 *
 * @author fengwk
 */
@Data
@Builder
public class TaskOutput {

    @Builder.Default
    private List<AnalysisResult> analyses = List.of();

    @Builder.Default
    private List<PageFailure> failures = List.of();

    private String message;

}
