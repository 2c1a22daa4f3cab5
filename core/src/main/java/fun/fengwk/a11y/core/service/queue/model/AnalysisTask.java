package fun.fengwk.a11y.core.service.queue.model;

import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of schedulable scan work.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
public class AnalysisTask {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private TaskType type;
    private String url;

    @Builder.Default
    private ScanOptions options = ScanOptions.defaults();

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    /**
     * Attempts already failed and retried.
     */
    private int retryCount;

    /**
     * Retry limit, null takes {@code a11y.queue.default-max-retries} at enqueue.
     */
    private Integer maxRetries;

    @Builder.Default
    private Instant createdAt = Instant.now();

    private Instant startedAt;
    private Instant completedAt;

    /**
     * Error of the last failed attempt.
     */
    private String lastError;

}
