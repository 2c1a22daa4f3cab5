package fun.fengwk.a11y.cli.all;

import fun.fengwk.a11y.core.service.batch.ParallelBatchAnalyzer;
import fun.fengwk.a11y.core.service.queue.TaskQueue;
import fun.fengwk.a11y.core.service.queue.TaskTimeoutException;
import fun.fengwk.a11y.core.service.queue.model.AnalysisTask;
import fun.fengwk.a11y.core.service.queue.model.TaskResult;
import fun.fengwk.a11y.core.service.queue.model.TaskType;
import fun.fengwk.a11y.core.service.scan.SiteAuditor;
import fun.fengwk.a11y.core.service.scan.model.AnalysisResult;
import fun.fengwk.a11y.core.service.scan.model.BatchResult;
import fun.fengwk.a11y.core.service.scan.model.PageFailure;
import fun.fengwk.a11y.core.service.scan.model.PageInfo;
import fun.fengwk.a11y.core.service.scan.model.ScanOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Non-interactive scan over the urls given on the command line.
 *
 * <p>Usage: {@code java -jar my-a11y-hub-cli-all.jar [--mode=batch|queue|site] [--wait-timeout-ms=N] url...}
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanCommandRunner implements ApplicationRunner {

    static final String MODE_BATCH = "batch";
    static final String MODE_QUEUE = "queue";
    static final String MODE_SITE = "site";

    private static final long DEFAULT_WAIT_TIMEOUT_MS = 600_000;

    private final ParallelBatchAnalyzer batchAnalyzer;
    private final TaskQueue taskQueue;
    private final SiteAuditor siteAuditor;

    @Override
    public void run(ApplicationArguments args) {
        List<String> urls = args.getNonOptionArgs();
        if (urls.isEmpty()) {
            log.info("usage: [--mode=batch|queue|site] [--wait-timeout-ms=N] url...");
            return;
        }

        String mode = resolveMode(args);
        switch (mode) {
            case MODE_BATCH:
                runBatch(urls);
                break;
            case MODE_QUEUE:
                runQueue(urls, resolveWaitTimeout(args));
                break;
            case MODE_SITE:
                runSite(urls);
                break;
            default:
                log.warn("unsupported mode, mode={}, expected one of batch, queue, site", mode);
        }
    }

    private void runBatch(List<String> urls) {
        List<PageInfo> pages = new ArrayList<>(urls.size());
        for (String url : urls) {
            pages.add(PageInfo.of(url));
        }
        logBatchResult(batchAnalyzer.analyzePages(pages));
    }

    private void runSite(List<String> urls) {
        for (String url : urls) {
            log.info("auditing site, startUrl={}", url);
            logBatchResult(siteAuditor.auditSite(url, ScanOptions.defaults()));
        }
    }

    private void runQueue(List<String> urls, Duration waitTimeout) {
        List<AnalysisTask> tasks = new ArrayList<>(urls.size());
        for (String url : urls) {
            tasks.add(AnalysisTask.builder().type(TaskType.SINGLE_PAGE).url(url).build());
        }
        List<String> taskIds = taskQueue.addBatch(tasks);

        int succeeded = 0;
        for (int i = 0; i < taskIds.size(); i++) {
            String taskId = taskIds.get(i);
            try {
                TaskResult result = taskQueue.waitForCompletion(taskId, waitTimeout);
                if (result.isSuccess()) {
                    succeeded++;
                    for (AnalysisResult analysis : result.getOutput().getAnalyses()) {
                        logAnalysis(analysis);
                    }
                } else {
                    log.warn("page failed, url={}, error={}", urls.get(i),
                        result.getError() == null ? "unknown" : result.getError().getMessage());
                }
            } catch (TaskTimeoutException ex) {
                log.warn("page timed out, url={}, error={}", urls.get(i), ex.getMessage());
            }
        }
        log.info("queue scan finished, total={}, successful={}, failed={}",
            taskIds.size(), succeeded, taskIds.size() - succeeded);
    }

    private void logBatchResult(BatchResult result) {
        for (AnalysisResult analysis : result.getSuccessful()) {
            logAnalysis(analysis);
        }
        for (PageFailure failure : result.getFailed()) {
            log.warn("page failed, url={}, error={}", failure.getPage().getUrl(), failure.getError());
        }
        log.info("batch scan finished, successful={}, failed={}, successRate={}%, totalTimeMs={}",
            result.getSuccessful().size(),
            result.getFailed().size(),
            String.format(Locale.ROOT, "%.1f", result.getMetrics().getSuccessRate()),
            result.getMetrics().getTotalTime());
    }

    private void logAnalysis(AnalysisResult analysis) {
        log.info("page analyzed, url={}, violations={}, critical={}, serious={}, moderate={}, minor={}",
            analysis.getUrl(),
            analysis.getSummary().getTotalViolations(),
            analysis.getSummary().getCriticalViolations(),
            analysis.getSummary().getSeriousViolations(),
            analysis.getSummary().getModerateViolations(),
            analysis.getSummary().getMinorViolations());
    }

    private static String resolveMode(ApplicationArguments args) {
        List<String> values = args.getOptionValues("mode");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return MODE_BATCH;
        }
        return values.get(0).trim().toLowerCase(Locale.ROOT);
    }

    private static Duration resolveWaitTimeout(ApplicationArguments args) {
        List<String> values = args.getOptionValues("wait-timeout-ms");
        if (values == null || values.isEmpty()) {
            return Duration.ofMillis(DEFAULT_WAIT_TIMEOUT_MS);
        }
        try {
            return Duration.ofMillis(Math.max(1, Long.parseLong(values.get(0).trim())));
        } catch (NumberFormatException ex) {
            log.warn("invalid wait-timeout-ms, value={}, fallback={}", values.get(0), DEFAULT_WAIT_TIMEOUT_MS);
            return Duration.ofMillis(DEFAULT_WAIT_TIMEOUT_MS);
        }
    }

}
