package fun.fengwk.a11y.core.service.batch;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.a11y.core.service.browser.runtime.BrowserResourceManager;
import fun.fengwk.a11y.core.service.browser.runtime.NavigateOptions;
import fun.fengwk.a11y.core.service.scan.ScanDispatcher;
import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.BatchMetrics;
import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.PageFailure;
import fun.fengwk.a11y.core.service.scan.model.PageInfo;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded fan-out analysis over a caller-supplied page list.
 *
 * <p>Pages are split into fixed-size batches processed one after another with a delay in between.
 * Within a batch at most {@code maxConcurrency} pages are in analysis at any time. Every page gets its own
 * browser session, which is released after each attempt. The caller blocks until the whole run is done.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ParallelBatchAnalyzer {

    private final BrowserResourceManager resourceManager;
    private final ScanDispatcher scanDispatcher;
    private final BatchAnalysisProperties properties;
    private final ExecutorService executor;
    private final AtomicInteger threadIdGen = new AtomicInteger(1);
    private final AtomicInteger activeSessions = new AtomicInteger(0);
    private volatile int maxConcurrency;

    public ParallelBatchAnalyzer(
        BrowserResourceManager resourceManager,
        ScanDispatcher scanDispatcher,
        BatchAnalysisProperties properties
    ) {
        this.resourceManager = resourceManager;
        this.scanDispatcher = scanDispatcher;
        this.properties = properties;
        this.maxConcurrency = Math.max(1, properties.getMaxConcurrency());
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("a11y-batch-analyzer-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Options from {@code a11y.batch} with the current default concurrency.
     */
    public BatchAnalysisOptions defaultOptions() {
        return BatchAnalysisOptions.fromProperties(properties).toBuilder()
            .maxConcurrency(maxConcurrency)
            .build();
    }

    public BatchResult analyzePages(List<PageInfo> pages) {
        return analyzePages(pages, defaultOptions());
    }

    public BatchResult analyzePages(List<PageInfo> pages, BatchAnalysisOptions options) {
        BatchAnalysisOptions normalizedOptions = normalizeOptions(options);
        List<PageInfo> input = pages == null ? List.of() : pages;
        log.info("starting parallel analysis, totalPages={}, maxConcurrency={}, batchSize={}",
            input.size(), normalizedOptions.getMaxConcurrency(), normalizedOptions.getBatchSize());

        long startAt = System.currentTimeMillis();
        List<AnalysisResult> successful = new ArrayList<>();
        List<PageFailure> failed = new ArrayList<>();
        List<List<PageInfo>> batches = createBatches(input, normalizedOptions.getBatchSize());

        for (int i = 0; i < batches.size(); i++) {
            List<PageInfo> batch = batches.get(i);
            log.info("processing batch {}/{}, batchSize={}", i + 1, batches.size(), batch.size());
            try {
                BatchResult batchResult = processBatch(batch, normalizedOptions);
                successful.addAll(batchResult.getSuccessful());
                failed.addAll(batchResult.getFailed());
            } catch (Exception ex) {
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                if (!normalizedOptions.isSkipOnError()) {
                    log.warn("batch {}/{} failed, aborting run, error={}", i + 1, batches.size(), error, ex);
                    throw new BatchAnalysisException("batch " + (i + 1) + " processing failed: " + error, ex);
                }
                log.warn("batch {}/{} failed, skipping, error={}", i + 1, batches.size(), error);
                for (PageInfo page : batch) {
                    failed.add(PageFailure.builder().page(page).error(error).build());
                }
            }

            if (i < batches.size() - 1 && normalizedOptions.getDelayBetweenBatchesMs() > 0) {
                if (!pause(normalizedOptions.getDelayBetweenBatchesMs())) {
                    throw new BatchAnalysisException("interrupted between batches", new InterruptedException());
                }
            }
        }

        long totalTime = System.currentTimeMillis() - startAt;
        int totalProcessed = successful.size() + failed.size();
        double successRate = totalProcessed > 0 ? successful.size() * 100.0 / totalProcessed : 0;
        BatchMetrics metrics = BatchMetrics.builder()
            .totalTime(totalTime)
            .averageTimePerPage(totalProcessed > 0 ? (double) totalTime / totalProcessed : 0)
            .successRate(successRate)
            .build();

        log.info("parallel analysis completed, successful={}, failed={}, successRate={}%, totalTimeMs={}",
            successful.size(), failed.size(), String.format("%.1f", successRate), totalTime);
        return BatchResult.builder()
            .successful(successful)
            .failed(failed)
            .metrics(metrics)
            .build();
    }

    public AnalyzerStatus getStatus() {
        return AnalyzerStatus.builder()
            .maxConcurrency(maxConcurrency)
            .activeSessions(activeSessions.get())
            .build();
    }

    /**
     * Change the default concurrency of later runs.
     */
    public void updateConcurrency(int newConcurrency) {
        if (newConcurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.maxConcurrency = newConcurrency;
        log.info("updated analyzer concurrency to {}", newConcurrency);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private BatchResult processBatch(List<PageInfo> batch, BatchAnalysisOptions options)
        throws InterruptedException, ExecutionException {
        // Batch-level step: the shared browser must be up before pages fan out.
        resourceManager.initialize();

        List<AnalysisResult> successful = Collections.synchronizedList(new ArrayList<>());
        List<PageFailure> failed = Collections.synchronizedList(new ArrayList<>());
        Semaphore slots = new Semaphore(options.getMaxConcurrency());
        List<Future<?>> futures = new ArrayList<>(batch.size());
        try {
            for (PageInfo page : batch) {
                slots.acquire();
                try {
                    futures.add(executor.submit(() -> {
                        try {
                            analyzePage(page, options, successful, failed);
                        } finally {
                            slots.release();
                        }
                    }));
                } catch (RejectedExecutionException ex) {
                    slots.release();
                    throw ex;
                }
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException | RuntimeException ex) {
            futures.forEach(future -> future.cancel(true));
            throw ex;
        }

        return BatchResult.builder()
            .successful(new ArrayList<>(successful))
            .failed(new ArrayList<>(failed))
            .build();
    }

    private void analyzePage(
        PageInfo page,
        BatchAnalysisOptions options,
        List<AnalysisResult> successful,
        List<PageFailure> failed
    ) {
        ScanOptions scanOptions = options.getScanOptions() == null ? ScanOptions.defaults() : options.getScanOptions();
        int attempt = 0;
        while (true) {
            String sessionId = "analysis-" + UUID.randomUUID();
            boolean retry = false;
            activeSessions.incrementAndGet();
            try {
                Page browserPage = resourceManager.navigateToUrl(sessionId, page.getUrl(), NavigateOptions.builder()
                    .waitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .timeoutMs(scanOptions.getTimeoutMs())
                    .settleDelayMs(scanOptions.getSettleDelayMs())
                    .build());
                AnalysisResult result = resourceManager.runExclusive(
                    () -> scanDispatcher.analyzePageWithTools(browserPage, scanOptions));
                successful.add(result);
                return;
            } catch (Exception ex) {
                String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                if (options.isRetryFailedPages() && attempt < options.getMaxRetries()) {
                    attempt++;
                    retry = true;
                    log.warn("page analysis failed, retrying, url={}, attempt={}/{}, error={}",
                        page.getUrl(), attempt, options.getMaxRetries(), error);
                } else {
                    log.warn("page analysis failed, url={}, attempts={}, error={}", page.getUrl(), attempt + 1, error);
                    failed.add(PageFailure.builder().page(page).error(error).build());
                    return;
                }
            } finally {
                activeSessions.decrementAndGet();
                resourceManager.cleanup(sessionId);
            }

            if (retry && !pause(options.getRetryBaseDelayMs() * attempt)) {
                failed.add(PageFailure.builder().page(page).error("interrupted before retry").build());
                return;
            }
        }
    }

    private BatchAnalysisOptions normalizeOptions(BatchAnalysisOptions options) {
        BatchAnalysisOptions raw = options == null ? defaultOptions() : options;
        return raw.toBuilder()
            .maxConcurrency(Math.max(1, raw.getMaxConcurrency()))
            .batchSize(Math.max(1, raw.getBatchSize()))
            .delayBetweenBatchesMs(Math.max(0L, raw.getDelayBetweenBatchesMs()))
            .maxRetries(Math.max(0, raw.getMaxRetries()))
            .retryBaseDelayMs(Math.max(0L, raw.getRetryBaseDelayMs()))
            .build();
    }

    static <T> List<List<T>> createBatches(List<T> items, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            batches.add(List.copyOf(items.subList(i, Math.min(items.size(), i + batchSize))));
        }
        return batches;
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("analyzer pause interrupted, millis={}", millis);
            return false;
        }
    }

}
