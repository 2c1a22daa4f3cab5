package fun.fengwk.a11y.core.service.batch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default options of the parallel batch analyzer.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "a11y.batch")
public class BatchAnalysisProperties {

    /**
     * Pages analyzed concurrently within one batch.
     */
    private int maxConcurrency = 5;

    /**
     * Pages per batch, batches run one after another.
     */
    private int batchSize = 10;

    /**
     * Pause between two batches, politeness toward the target site.
     */
    private long delayBetweenBatchesMs = 1000;

    /**
     * Whether failed pages are retried.
     */
    private boolean retryFailedPages = true;

    /**
     * Retries per page after the first attempt.
     */
    private int maxRetries = 2;

    /**
     * Retry n waits {@code retryBaseDelayMs * n}.
     */
    private long retryBaseDelayMs = 1000;

    /**
     * Absorb a batch-level failure by marking its pages failed instead of aborting the run.
     */
    private boolean skipOnError = false;

}
