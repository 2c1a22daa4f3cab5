package fun.fengwk.a11y.core.service.queue;

import fun.fengwk.a11y.core.service.queue.model.AnalysisTask;
import fun.fengwk.a11y.core.service.queue.model.TaskResult;

/**
 * Observer of task queue events. Callbacks run on queue or worker threads and must not block.
 *
 * @author fengwk
 */
public interface TaskQueueListener {

    default void onTaskAdded(AnalysisTask task) {
    }

    default void onTaskStarted(AnalysisTask task, String workerId) {
    }

    default void onTaskCompleted(AnalysisTask task, TaskResult result) {
    }

    /**
     * Terminal failure, retries exhausted or task cancelled.
     */
    default void onTaskFailed(AnalysisTask task, TaskResult result) {
    }

    default void onTaskRetry(AnalysisTask task, TaskResult result) {
    }

    default void onWorkersScaled(int workerCount) {
    }

    default void onShutdown() {
    }

}
