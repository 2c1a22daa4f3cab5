package fun.fengwk.a11y.core.service.batch;

import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import lombok.Builder;
import lombok.Data;

/**
 * Options of one {@link ParallelBatchAnalyzer#analyzePages} call.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
public class BatchAnalysisOptions {

    private int maxConcurrency;
    private int batchSize;
    private long delayBetweenBatchesMs;
    private boolean retryFailedPages;
    private int maxRetries;
    private long retryBaseDelayMs;
    private boolean skipOnError;

    @Builder.Default
    private ScanOptions scanOptions = ScanOptions.defaults();

    public static BatchAnalysisOptions fromProperties(BatchAnalysisProperties properties) {
        return BatchAnalysisOptions.builder()
            .maxConcurrency(properties.getMaxConcurrency())
            .batchSize(properties.getBatchSize())
            .delayBetweenBatchesMs(properties.getDelayBetweenBatchesMs())
            .retryFailedPages(properties.isRetryFailedPages())
            .maxRetries(properties.getMaxRetries())
            .retryBaseDelayMs(properties.getRetryBaseDelayMs())
            .skipOnError(properties.isSkipOnError())
            .build();
    }

}
