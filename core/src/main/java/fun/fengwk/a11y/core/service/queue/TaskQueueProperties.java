package fun.fengwk.a11y.core.service.queue;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Task queue configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "a11y.queue")
public class TaskQueueProperties {

    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 20;

    /**
     * Initial worker count.
     */
    private int maxConcurrentTasks = 5;

    /**
     * Dispatch tick interval.
     */
    private long pollIntervalMs = 1000;

    /**
     * Poll interval while shutdown drains in-flight tasks.
     */
    private long shutdownPollIntervalMs = 100;

    /**
     * Max time shutdown waits for in-flight tasks, 0 waits indefinitely.
     */
    private long shutdownTimeoutMs = 0;

    /**
     * Retry limit for tasks that do not set one.
     */
    private int defaultMaxRetries = 3;

    /**
     * Retry delay per retry count, 0 retries on the next tick.
     */
    private long retryBackoffMs = 0;

}
