package fun.fengwk.a11y.core.service.queue;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.a11y.core.service.browser.runtime.BrowserResourceManager;
import fun.fengwk.a11y.core.service.browser.runtime.NavigateOptions;
import fun.fengwk.a11y.core.service.queue.model.AnalysisTask;
import fun.fengwk.a11y.core.service.queue.model.TaskOutput;
import fun.fengwk.a11y.core.service.queue.model.TaskResult;
import fun.fengwk.a11y.core.service.queue.model.WorkerHealth;
import fun.fengwk.a11y.core.service.queue.model.WorkerMetrics;
import fun.fengwk.a11y.core.service.scan.ScanDispatcher;
import fun.fengwk.a11y.core.service.scan.SiteAuditor;
import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.PageFailure;
import fun.fengwk.a11y.core.service.scan.model.PageInfo;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution slot running one analysis task at a time.
 *
 * <p>The worker id doubles as its browser session key, so two workers never share a context.
 * Every attempt ends with a {@link TaskResult} reported to the {@link WorkerListener}, and the session is
 * released and availability restored afterwards whatever the outcome.
 *
 * @author fengwk
 */
public class AnalysisWorker {

    private static final Logger log = LoggerFactory.getLogger(AnalysisWorker.class);

    static final double HEALTHY_ERROR_RATE = 0.1;
    static final Duration ACTIVITY_WINDOW = Duration.ofMinutes(5);

    private final String workerId;
    private final BrowserResourceManager resourceManager;
    private final ScanDispatcher scanDispatcher;
    private final SiteAuditor siteAuditor;
    private final Executor executor;
    private final WorkerListener listener;
    private final Clock clock;
    private final Instant startTime;

    private final AtomicBoolean available = new AtomicBoolean(true);
    private volatile boolean running = false;
    private volatile boolean retiring = false;
    private volatile boolean closed = false;
    private volatile AnalysisTask currentTask;
    private volatile Instant lastActivity;
    private volatile CompletableFuture<TaskResult> inFlight;
    private volatile Thread runner;

    private int processedTasks;
    private int errorCount;
    private long totalProcessingTime;

    public AnalysisWorker(
        String workerId,
        BrowserResourceManager resourceManager,
        ScanDispatcher scanDispatcher,
        SiteAuditor siteAuditor,
        Executor executor,
        WorkerListener listener
    ) {
        this(workerId, resourceManager, scanDispatcher, siteAuditor, executor, listener, Clock.systemUTC());
    }

    AnalysisWorker(
        String workerId,
        BrowserResourceManager resourceManager,
        ScanDispatcher scanDispatcher,
        SiteAuditor siteAuditor,
        Executor executor,
        WorkerListener listener,
        Clock clock
    ) {
        this.workerId = workerId;
        this.resourceManager = resourceManager;
        this.scanDispatcher = scanDispatcher;
        this.siteAuditor = siteAuditor;
        this.executor = executor;
        this.listener = listener;
        this.clock = clock;
        this.startTime = clock.instant();
        this.lastActivity = startTime;
    }

    public String getId() {
        return workerId;
    }

    public boolean isAvailable() {
        return available.get();
    }

    public boolean isRetiring() {
        return retiring;
    }

    /**
     * No task body is running, including its finalization.
     */
    public boolean isIdle() {
        return !running;
    }

    public AnalysisTask getCurrentTask() {
        return currentTask;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Start {@code task} on the worker executor.
     *
     * @throws WorkerBusyException if a task is already running
     * @throws IllegalStateException if the worker is closed
     */
    public CompletableFuture<TaskResult> processTask(AnalysisTask task) {
        if (closed) {
            throw new IllegalStateException("worker " + workerId + " is closed");
        }
        if (!available.compareAndSet(true, false)) {
            throw new WorkerBusyException("worker " + workerId + " is not available");
        }
        running = true;
        currentTask = task;
        lastActivity = clock.instant();

        try {
            CompletableFuture<TaskResult> future = CompletableFuture.supplyAsync(() -> runTask(task), executor);
            inFlight = future;
            return future;
        } catch (RejectedExecutionException ex) {
            currentTask = null;
            running = false;
            available.set(true);
            throw ex;
        }
    }

    public synchronized WorkerMetrics getMetrics() {
        return WorkerMetrics.builder()
            .tasksProcessed(processedTasks)
            .averageProcessingTime(processedTasks > 0 ? (double) totalProcessingTime / processedTasks : 0)
            .memoryUsage(usedMemory())
            .errorRate(processedTasks > 0 ? (double) errorCount / processedTasks : 0)
            .uptime(Duration.between(startTime, clock.instant()).toMillis())
            .build();
    }

    public WorkerHealth getHealth() {
        WorkerMetrics metrics = getMetrics();
        Instant activity = lastActivity;
        boolean recentlyActive = Duration.between(activity, clock.instant()).compareTo(ACTIVITY_WINDOW) < 0;
        AnalysisTask task = currentTask;
        return WorkerHealth.builder()
            .workerId(workerId)
            .healthy(metrics.getErrorRate() < HEALTHY_ERROR_RATE && recentlyActive)
            .metrics(metrics)
            .lastActivity(activity)
            .currentTaskId(task == null ? null : task.getId())
            .build();
    }

    /**
     * Take no further work once the running task completes.
     */
    public void retire() {
        retiring = true;
    }

    /**
     * Wait for the in-flight task, then close the worker for good and release its session.
     * Called from the task's own thread, for instance by a listener, it closes without waiting.
     */
    public void cleanup() {
        closed = true;
        CompletableFuture<TaskResult> future = inFlight;
        if (future != null && runner != Thread.currentThread()) {
            try {
                future.join();
            } catch (CancellationException | CompletionException ex) {
                log.debug("in-flight task ended abnormally during cleanup, workerId={}", workerId);
            }
        }
        available.set(false);
        currentTask = null;
        resourceManager.cleanup(workerId);
        log.debug("worker cleaned up, workerId={}", workerId);
    }

    private TaskResult runTask(AnalysisTask task) {
        runner = Thread.currentThread();
        long startAt = clock.millis();
        try {
            TaskOutput output = execute(task);
            long duration = clock.millis() - startAt;
            recordAttempt(duration, false);
            TaskResult result = TaskResult.builder()
                .taskId(task.getId())
                .workerId(workerId)
                .success(true)
                .output(output)
                .duration(duration)
                .memoryUsage(usedMemory())
                .workerMetrics(getMetrics())
                .build();
            log.info("task completed, taskId={}, workerId={}, durationMs={}", task.getId(), workerId, duration);
            notifyListener(() -> listener.onTaskCompleted(this, task, result));
            return result;
        } catch (Exception ex) {
            long duration = clock.millis() - startAt;
            recordAttempt(duration, true);
            TaskResult result = TaskResult.builder()
                .taskId(task.getId())
                .workerId(workerId)
                .success(false)
                .error(ex)
                .duration(duration)
                .memoryUsage(usedMemory())
                .workerMetrics(getMetrics())
                .build();
            log.warn("task failed, taskId={}, workerId={}, error={}", task.getId(), workerId, ex.getMessage());
            notifyListener(() -> listener.onTaskFailed(this, task, result));
            return result;
        } finally {
            resourceManager.cleanup(workerId);
            currentTask = null;
            lastActivity = clock.instant();
            runner = null;
            running = false;
            if (!closed && !retiring) {
                available.set(true);
            }
        }
    }

    private TaskOutput execute(AnalysisTask task) {
        if (task.getType() == null) {
            throw new IllegalArgumentException("task type is required");
        }
        ScanOptions options = task.getOptions() == null ? ScanOptions.defaults() : task.getOptions();
        switch (task.getType()) {
            case SINGLE_PAGE:
                resourceManager.initialize();
                return processSinglePage(task, options);
            case BATCH:
                resourceManager.initialize();
                return processBatch(task, options);
            case FULL_SITE:
                return processFullSite(task, options);
            default:
                throw new IllegalArgumentException("unsupported task type: " + task.getType());
        }
    }

    private TaskOutput processSinglePage(AnalysisTask task, ScanOptions options) {
        try {
            AnalysisResult result = analyzeUrl(task.getUrl(), options);
            return TaskOutput.builder()
                .analyses(List.of(result))
                .message("single page analysis completed for " + task.getUrl())
                .build();
        } finally {
            resourceManager.cleanup(workerId);
        }
    }

    private TaskOutput processBatch(AnalysisTask task, ScanOptions options) {
        List<String> urls = options.getBatchUrls() == null || options.getBatchUrls().isEmpty()
            ? List.of(task.getUrl())
            : options.getBatchUrls();
        List<AnalysisResult> analyses = new ArrayList<>();
        List<PageFailure> failures = new ArrayList<>();

        for (String url : urls) {
            try {
                analyses.add(analyzeUrl(url, options));
            } catch (RuntimeException ex) {
                log.info("batch url failed, taskId={}, url={}, error={}", task.getId(), url, ex.getMessage());
                failures.add(PageFailure.builder().page(PageInfo.of(url)).error(ex.getMessage()).build());
            } finally {
                resourceManager.cleanup(workerId);
            }
        }

        String message = "batch analysis completed: " + analyses.size() + " successful, " + failures.size() + " failed";
        if (analyses.isEmpty()) {
            throw new TaskExecutionException("batch analysis failed for all " + urls.size() + " urls");
        }
        return TaskOutput.builder()
            .analyses(analyses)
            .failures(failures)
            .message(message)
            .build();
    }

    private TaskOutput processFullSite(AnalysisTask task, ScanOptions options) {
        BatchResult audit = siteAuditor.auditSite(task.getUrl(), options);
        List<AnalysisResult> analyses = audit.getSuccessful() == null ? List.of() : audit.getSuccessful();
        List<PageFailure> failures = audit.getFailed() == null ? List.of() : audit.getFailed();
        if (analyses.isEmpty()) {
            throw new TaskExecutionException("full site analysis produced no successful page for " + task.getUrl()
                + ", failed=" + failures.size());
        }
        return TaskOutput.builder()
            .analyses(analyses)
            .failures(failures)
            .message("full site analysis completed for " + task.getUrl())
            .build();
    }

    private AnalysisResult analyzeUrl(String url, ScanOptions options) {
        Page page = resourceManager.navigateToUrl(workerId, url, NavigateOptions.builder()
            .waitUntil(WaitUntilState.NETWORKIDLE)
            .timeoutMs(options.getTimeoutMs())
            .settleDelayMs(options.getSettleDelayMs())
            .build());
        return resourceManager.runExclusive(() -> scanDispatcher.analyzePageWithTools(page, options));
    }

    private synchronized void recordAttempt(long duration, boolean error) {
        processedTasks++;
        totalProcessingTime += duration;
        if (error) {
            errorCount++;
        }
    }

    private void notifyListener(Runnable notification) {
        if (listener == null) {
            return;
        }
        try {
            notification.run();
        } catch (RuntimeException ex) {
            log.warn("worker listener failed, workerId={}", workerId, ex);
        }
    }

    private static long usedMemory() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

}
