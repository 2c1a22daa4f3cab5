package fun.fengwk.a11y.core.configuration;

import fun.fengwk.a11y.core.service.browser.runtime.BrowserResourceManager;
import fun.fengwk.a11y.core.service.queue.AnalysisWorker;
import fun.fengwk.a11y.core.service.queue.TaskQueue;
import fun.fengwk.a11y.core.service.queue.TaskQueueProperties;
import fun.fengwk.a11y.core.service.scan.ScanDispatcher;
import fun.fengwk.a11y.core.service.scan.SiteAuditor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @author fengwk
 */
@Configuration
public class ScanRuntimeConfiguration {

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public TaskQueue taskQueue(
        TaskQueueProperties taskQueueProperties,
        BrowserResourceManager browserResourceManager,
        ScanDispatcher scanDispatcher,
        SiteAuditor siteAuditor
    ) {
        return new TaskQueue(taskQueueProperties, (workerId, executor, listener) -> new AnalysisWorker(
            workerId, browserResourceManager, scanDispatcher, siteAuditor, executor, listener));
    }

}
